package com.nosota.lingodesk.api.request;

import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.UpdateType;
import jakarta.validation.constraints.NotBlank;

/**
 * @param updateText Free-text note
 * @param updateType Kind of update, {@code note} when omitted
 * @param newStatus  Status applied to the parent request; required for {@code status_change}
 */
public record CreateProjectUpdateRequest(
        @NotBlank(message = "Update text is required")
        String updateText,

        UpdateType updateType,

        OrderStatus newStatus
) {
}
