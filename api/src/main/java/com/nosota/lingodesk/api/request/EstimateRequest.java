package com.nosota.lingodesk.api.request;

import com.nosota.lingodesk.api.model.Workflow;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * @param characterCount  Characters in the source document
 * @param targetLanguages Languages to translate into
 * @param workflow        Workflow tier
 */
public record EstimateRequest(
        @NotNull(message = "Character count is required")
        @PositiveOrZero(message = "Character count must not be negative")
        @Max(value = 1_000_000_000L, message = "Character count must not exceed 1000000000")
        Long characterCount,

        @NotEmpty(message = "At least one target language is required")
        List<String> targetLanguages,

        @NotNull(message = "Workflow is required")
        Workflow workflow
) {
}
