package com.nosota.lingodesk.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Translation workflow tier. Each tier sets the per-character credit rate.
 */
public enum Workflow {
    /**
     * Tier 1: machine translation only.
     */
    AI_NEURAL("ai-neural", 1),

    /**
     * Tier 2: machine translation with automated quality check.
     */
    AI_TRANSLATION_QC("ai-translation-qc", 2),

    /**
     * Tier 3: machine translation with expert human review.
     */
    AI_TRANSLATION_HUMAN("ai-translation-human", 3);

    private final String value;
    private final int creditsPerCharacter;

    Workflow(String value, int creditsPerCharacter) {
        this.value = value;
        this.creditsPerCharacter = creditsPerCharacter;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getCreditsPerCharacter() {
        return creditsPerCharacter;
    }

    @JsonCreator
    public static Workflow fromValue(String value) {
        for (Workflow workflow : values()) {
            if (workflow.value.equalsIgnoreCase(value)) {
                return workflow;
            }
        }
        throw new IllegalArgumentException("Unknown workflow: " + value);
    }
}
