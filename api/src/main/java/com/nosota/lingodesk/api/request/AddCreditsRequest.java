package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * @param amount      Credits to add, a positive integer up to one billion
 * @param description Ledger description; a default is used when omitted
 */
public record AddCreditsRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be a positive integer")
        @Max(value = 1_000_000_000L, message = "Amount must not exceed 1000000000")
        Long amount,

        String description
) {
}
