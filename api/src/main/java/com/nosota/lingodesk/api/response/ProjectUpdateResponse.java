package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.api.model.UpdateType;

import java.time.LocalDateTime;

public record ProjectUpdateResponse(
        Long id,
        Long requestId,
        Long userId,
        String updateText,
        UpdateType updateType,
        OrderStatus newStatus,
        LocalDateTime createdAt
) {
}
