package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.OrderStatus;

import java.time.LocalDateTime;
import java.util.List;

public record OrderSummaryResponse(
        Long id,
        String fileName,
        OrderStatus status,
        String sourceLanguage,
        List<String> targetLanguages,
        Integer completionPercentage,
        LocalDateTime createdAt
) {
}
