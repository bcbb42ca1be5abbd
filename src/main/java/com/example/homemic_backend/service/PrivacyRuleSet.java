package com.example.homemic_backend.service;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Immutable snapshot of every privacy rule the gate evaluates.
 */
public record PrivacyRuleSet(List<NodeMute> nodeMutes,
                             boolean globalMute,
                             String globalMuteReason,
                             List<QuietWindow> quietWindows,
                             ZoneId zone) {

    public PrivacyRuleSet {
        nodeMutes = nodeMutes == null ? List.of() : List.copyOf(nodeMutes);
        quietWindows = quietWindows == null ? List.of() : List.copyOf(quietWindows);
        zone = zone == null ? ZoneId.of("UTC") : zone;
    }

    public static PrivacyRuleSet empty() {
        return new PrivacyRuleSet(List.of(), false, null, List.of(), ZoneId.of("UTC"));
    }

    /**
     * A mute on one node covering {@code [startsAt, expiresAt)}. A {@code null} bound is open:
     * {@code expiresAt == null} means until unmuted.
     */
    public record NodeMute(String nodeId, Instant startsAt, Instant expiresAt, String reason) {
        public boolean appliesAt(Instant at) {
            return (startsAt == null || !at.isBefore(startsAt))
                    && (expiresAt == null || at.isBefore(expiresAt));
        }
    }

    /** Recurring daily window {@code [start, end)}; wraps midnight when {@code end < start}. */
    public record QuietWindow(LocalTime start, LocalTime end, String label) {
        public boolean contains(LocalTime t) {
            if (start.equals(end)) {
                return false;
            }
            if (start.isBefore(end)) {
                return !t.isBefore(start) && t.isBefore(end);
            }
            return !t.isBefore(start) || t.isBefore(end);
        }
    }
}
