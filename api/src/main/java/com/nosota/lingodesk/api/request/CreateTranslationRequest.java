package com.nosota.lingodesk.api.request;

import com.nosota.lingodesk.api.model.Priority;
import com.nosota.lingodesk.api.model.Workflow;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Submission of a translation order.
 *
 * <p>This is the single contract shared by the session API and the API-key API.
 * Credits and price are always computed by the server from {@code characterCount},
 * the number of target languages and the workflow tier.
 *
 * @param fileName        Name of the uploaded document
 * @param fileFormat      Format label; derived from the file extension when omitted
 * @param fileSize        Size in bytes
 * @param wordCount       Estimated words
 * @param characterCount  Estimated characters
 * @param imagesWithText  Images containing text
 * @param subjectMatter   Detected or chosen subject matter
 * @param sourceLanguage  Source language
 * @param targetLanguages Target languages (non-empty)
 * @param workflow        Workflow tier
 * @param priority        Priority, {@code medium} when omitted
 * @param dueDate         Optional due date
 */
public record CreateTranslationRequest(
        @NotBlank(message = "File name is required")
        String fileName,

        String fileFormat,

        @PositiveOrZero(message = "File size must not be negative")
        Long fileSize,

        @PositiveOrZero(message = "Word count must not be negative")
        Long wordCount,

        @NotNull(message = "Character count is required")
        @PositiveOrZero(message = "Character count must not be negative")
        @Max(value = 1_000_000_000L, message = "Character count must not exceed 1000000000")
        Long characterCount,

        @PositiveOrZero(message = "Images with text must not be negative")
        Integer imagesWithText,

        String subjectMatter,

        @NotBlank(message = "Source language is required")
        String sourceLanguage,

        @NotEmpty(message = "At least one target language is required")
        List<@NotBlank String> targetLanguages,

        @NotNull(message = "Workflow is required")
        Workflow workflow,

        Priority priority,

        LocalDateTime dueDate
) {
}
