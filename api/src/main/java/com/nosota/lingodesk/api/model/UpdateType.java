package com.nosota.lingodesk.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of project update attached to a translation request.
 * Only STATUS_CHANGE mutates the parent request.
 */
public enum UpdateType {
    NOTE("note"),
    STATUS_CHANGE("status_change"),
    MILESTONE("milestone"),
    ISSUE("issue");

    private final String value;

    UpdateType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UpdateType fromValue(String value) {
        for (UpdateType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown update type: " + value);
    }
}
