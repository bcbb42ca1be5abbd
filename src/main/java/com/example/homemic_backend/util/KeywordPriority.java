package com.example.homemic_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum KeywordPriority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static KeywordPriority fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return KeywordPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
