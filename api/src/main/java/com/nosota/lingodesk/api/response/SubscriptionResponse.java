package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;

import java.time.LocalDateTime;

public record SubscriptionResponse(
        String message,
        SubscriptionPlan plan,
        SubscriptionStatus status,
        LocalDateTime renewal
) {
}
