package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.OrderStatus;

import java.time.LocalDateTime;

/**
 * Envelope returned by the API-key surface when an order is submitted.
 *
 * @param estimatedCompletionTime One day after submission
 */
public record OrderCreatedResponse(
        Long id,
        OrderStatus status,
        Long creditsRequired,
        String totalCost,
        LocalDateTime estimatedCompletionTime
) {
}
