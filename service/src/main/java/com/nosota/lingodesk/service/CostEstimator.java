package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.model.Workflow;
import com.nosota.lingodesk.api.response.EstimateResponse;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes the credit cost and price of a translation order.
 *
 * <p>Formula:
 * <pre>
 * totalChars      = characterCount * targetLanguageCount
 * creditsRequired = totalChars * workflow rate      (1, 2 or 3 credits per character)
 * totalCost       = creditsRequired * 0.001 GBP     (formatted "£0.00")
 * </pre>
 *
 * <p>Pure function. Zero characters or zero languages give a zero estimate; callers validate
 * their input beforehand.
 */
@Component
public class CostEstimator {

    static final BigDecimal PRICE_PER_CREDIT = new BigDecimal("0.001");
    static final String CURRENCY_SYMBOL = "£";

    /**
     * @throws ArithmeticException if the totals do not fit in a {@code long}
     */
    public EstimateResponse estimate(long characterCount, int targetLanguageCount, Workflow workflow) {
        long totalChars = Math.multiplyExact(characterCount, (long) targetLanguageCount);
        // integer rates, so the ceiling is the product itself
        long creditsRequired = Math.multiplyExact(totalChars, (long) workflow.getCreditsPerCharacter());
        return new EstimateResponse(totalChars, creditsRequired, formatPrice(creditsRequired));
    }

    public String formatPrice(long credits) {
        BigDecimal amount = PRICE_PER_CREDIT.multiply(BigDecimal.valueOf(credits))
                .setScale(2, RoundingMode.HALF_UP);
        return CURRENCY_SYMBOL + amount.toPlainString();
    }
}
