package com.nosota.lingodesk.api.response;

/**
 * @param amount  Credits added
 * @param balance Balance after the top-up
 */
public record CreditsAddedResponse(
        String message,
        Long amount,
        Long balance
) {
}
