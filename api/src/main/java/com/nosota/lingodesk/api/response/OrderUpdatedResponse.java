package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.OrderStatus;

import java.time.LocalDateTime;

public record OrderUpdatedResponse(
        Long id,
        OrderStatus status,
        Integer completionPercentage,
        LocalDateTime updatedAt
) {
}
