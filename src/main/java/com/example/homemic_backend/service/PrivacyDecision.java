package com.example.homemic_backend.service;

public record PrivacyDecision(boolean admitted, Reason reason, String detail) {

    public enum Reason { ADMITTED, NODE_MUTED, GLOBAL_MUTE, QUIET_HOURS }

    public static PrivacyDecision admit() {
        return new PrivacyDecision(true, Reason.ADMITTED, null);
    }

    public static PrivacyDecision reject(Reason reason, String detail) {
        return new PrivacyDecision(false, reason, detail);
    }
}
