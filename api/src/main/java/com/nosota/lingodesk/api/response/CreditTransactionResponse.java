package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.CreditTransactionType;

import java.time.LocalDateTime;

/**
 * Ledger entry. Exactly one of {@code accountId} and {@code teamId} is set.
 */
public record CreditTransactionResponse(
        Long id,
        Long accountId,
        Long teamId,
        Long userId,
        Long amount,
        CreditTransactionType type,
        String description,
        LocalDateTime createdAt
) {
}
