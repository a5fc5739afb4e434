package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;

import java.time.LocalDateTime;

public record TeamResponse(
        Long id,
        String name,
        String description,
        String billingEmail,
        Long credits,
        SubscriptionPlan subscriptionPlan,
        SubscriptionStatus subscriptionStatus,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
