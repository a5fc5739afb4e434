package com.nosota.lingodesk.api.request;

import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.Priority;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.LocalDateTime;

/**
 * Partial update of the project-tracking fields of a translation request.
 * Null fields are left unchanged.
 */
public record UpdateTranslationRequest(
        OrderStatus status,

        Priority priority,

        @Min(value = 0, message = "Completion percentage must be between 0 and 100")
        @Max(value = 100, message = "Completion percentage must be between 0 and 100")
        Integer completionPercentage,

        LocalDateTime dueDate,

        String assignedTo
) {
}
