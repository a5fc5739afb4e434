package com.nosota.lingodesk.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.Priority;
import com.nosota.lingodesk.api.model.Workflow;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Full view of a translation request. {@code updates} is only populated
 * when a single request is fetched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationRequestResponse(
        Long id,
        Long userId,
        String fileName,
        String fileFormat,
        Long fileSize,
        Long wordCount,
        Long characterCount,
        Integer imagesWithText,
        String subjectMatter,
        String sourceLanguage,
        List<String> targetLanguages,
        Workflow workflow,
        Long creditsRequired,
        String totalCost,
        OrderStatus status,
        Priority priority,
        LocalDateTime dueDate,
        Integer completionPercentage,
        String assignedTo,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        List<ProjectUpdateResponse> updates
) {
    public TranslationRequestResponse withUpdates(List<ProjectUpdateResponse> updates) {
        return new TranslationRequestResponse(id, userId, fileName, fileFormat, fileSize, wordCount,
                characterCount, imagesWithText, subjectMatter, sourceLanguage, targetLanguages, workflow,
                creditsRequired, totalCost, status, priority, dueDate, completionPercentage, assignedTo,
                createdAt, updatedAt, updates);
    }
}
