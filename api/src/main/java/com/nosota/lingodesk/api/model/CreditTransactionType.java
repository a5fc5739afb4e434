package com.nosota.lingodesk.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a credit ledger entry.
 */
public enum CreditTransactionType {
    /**
     * Manual top-up by an administrator.
     */
    ADMIN_ADJUSTMENT("admin_adjustment"),

    /**
     * Credits bought by the account itself.
     */
    PURCHASE("purchase"),

    /**
     * Free credits granted when an account registers.
     */
    SIGNUP_BONUS("signup_bonus");

    private final String value;

    CreditTransactionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
