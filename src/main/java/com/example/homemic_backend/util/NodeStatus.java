package com.example.homemic_backend.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeStatus {
    ONLINE,
    OFFLINE,
    WARNING;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
