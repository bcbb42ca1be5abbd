package com.example.homemic_backend.service;

import com.example.homemic_backend.service.Interfaces.PrivacyRuleSource;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Decides whether a clip from a node, recorded at a given instant, may be processed.
 * Rules are checked in order: node mute, global mute, quiet hours. Holds no state and
 * never writes, so concurrent uploads can call it freely.
 */
@Component
public class PrivacyGate {

    private final PrivacyRuleSource rules;

    public PrivacyGate(PrivacyRuleSource rules) {
        this.rules = rules;
    }

    public PrivacyDecision check(String nodeId, Instant at) {
        return evaluate(rules.currentRules(), nodeId, at);
    }

    public boolean isAdmitted(String nodeId, Instant at) {
        return check(nodeId, at).admitted();
    }

    public static PrivacyDecision evaluate(PrivacyRuleSet rules, String nodeId, Instant at) {
        for (PrivacyRuleSet.NodeMute mute : rules.nodeMutes()) {
            if (mute.nodeId().equals(nodeId) && mute.appliesAt(at)) {
                return PrivacyDecision.reject(PrivacyDecision.Reason.NODE_MUTED, mute.reason());
            }
        }
        if (rules.globalMute()) {
            return PrivacyDecision.reject(PrivacyDecision.Reason.GLOBAL_MUTE, rules.globalMuteReason());
        }
        LocalTime local = at.atZone(rules.zone()).toLocalTime();
        for (PrivacyRuleSet.QuietWindow window : rules.quietWindows()) {
            if (window.contains(local)) {
                return PrivacyDecision.reject(PrivacyDecision.Reason.QUIET_HOURS, window.label());
            }
        }
        return PrivacyDecision.admit();
    }
}
