package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;

import java.time.LocalDateTime;

/**
 * @param usersCount Number of users in the account
 */
public record AccountResponse(
        Long id,
        String name,
        Long credits,
        SubscriptionPlan subscriptionPlan,
        SubscriptionStatus subscriptionStatus,
        LocalDateTime subscriptionRenewal,
        long usersCount,
        LocalDateTime createdAt
) {
}
