package com.nosota.lingodesk.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SubscriptionPlan {
    FREE("free"),
    BASIC("basic"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private final String value;

    SubscriptionPlan(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SubscriptionPlan fromValue(String value) {
        for (SubscriptionPlan plan : values()) {
            if (plan.value.equalsIgnoreCase(value)) {
                return plan;
            }
        }
        throw new IllegalArgumentException("Invalid subscription plan: " + value);
    }
}
