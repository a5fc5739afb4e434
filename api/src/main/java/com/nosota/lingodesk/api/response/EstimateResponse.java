package com.nosota.lingodesk.api.response;

/**
 * @param totalChars      Characters times target languages
 * @param creditsRequired Credits the order costs
 * @param totalCost       Formatted price, e.g. {@code £2.00}
 */
public record EstimateResponse(
        long totalChars,
        long creditsRequired,
        String totalCost
) {
}
