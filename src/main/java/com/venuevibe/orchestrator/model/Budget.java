package com.venuevibe.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Budget {
    LOW, MEDIUM, HIGH, ANY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Budget fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ANY;
        }
        return Budget.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
