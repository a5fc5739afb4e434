package com.nosota.lingodesk.api.request;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import jakarta.validation.constraints.NotNull;

public record ChangeSubscriptionRequest(
        @NotNull(message = "Plan is required")
        SubscriptionPlan planId
) {
}
