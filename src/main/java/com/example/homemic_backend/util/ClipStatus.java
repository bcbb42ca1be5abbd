package com.example.homemic_backend.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Processing state of a clip. Transitions only move forward, except {@code FAILED -> PENDING}
 * on an explicit retry.
 */
public enum ClipStatus {
    PENDING,
    PROCESSING,
    TRANSCRIBED,
    FAILED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ClipStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ClipStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
