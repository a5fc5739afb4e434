package com.nosota.lingodesk.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a translation request.
 *
 * <p>The pipeline is linear, in declaration order:
 * <pre>
 * pending → translation-in-progress → lqa-in-progress
 *         → human-reviewer-assigned → human-review-in-progress → complete
 * </pre>
 *
 * <p>COMPLETE is terminal for the client (translated files become downloadable),
 * but the server does not lock a completed request against further edits.
 */
public enum OrderStatus {
    PENDING("pending"),
    TRANSLATION_IN_PROGRESS("translation-in-progress"),
    LQA_IN_PROGRESS("lqa-in-progress"),
    HUMAN_REVIEWER_ASSIGNED("human-reviewer-assigned"),
    HUMAN_REVIEW_IN_PROGRESS("human-review-in-progress"),
    COMPLETE("complete");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Next status in the pipeline, or {@code null} for COMPLETE.
     */
    public OrderStatus next() {
        OrderStatus[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
    }

    public boolean isTerminal() {
        return this == COMPLETE;
    }

    @JsonCreator
    public static OrderStatus fromValue(String value) {
        for (OrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }
}
