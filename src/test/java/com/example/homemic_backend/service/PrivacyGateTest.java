package com.example.homemic_backend.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrivacyGateTest {

    private static final Instant NOON = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void admitsWhenNoRulesApply() {
        PrivacyDecision decision = PrivacyGate.evaluate(PrivacyRuleSet.empty(), "kitchen", NOON);

        assertThat(decision.admitted()).isTrue();
        assertThat(decision.reason()).isEqualTo(PrivacyDecision.Reason.ADMITTED);
    }

    @Test
    void nodeMuteWinsOverGlobalMuteAndQuietHours() {
        var rules = new PrivacyRuleSet(
                List.of(new PrivacyRuleSet.NodeMute("kitchen", null, null, "dinner")),
                true, "away",
                List.of(new PrivacyRuleSet.QuietWindow(LocalTime.of(11, 0), LocalTime.of(13, 0), "lunch")),
                ZoneId.of("UTC"));

        PrivacyDecision decision = PrivacyGate.evaluate(rules, "kitchen", NOON);

        assertThat(decision.admitted()).isFalse();
        assertThat(decision.reason()).isEqualTo(PrivacyDecision.Reason.NODE_MUTED);
        assertThat(decision.detail()).isEqualTo("dinner");
    }

    @Test
    void globalMuteAppliesToEveryNode() {
        var rules = new PrivacyRuleSet(List.of(), true, "away", List.of(), ZoneId.of("UTC"));

        PrivacyDecision decision = PrivacyGate.evaluate(rules, "office", NOON);

        assertThat(decision.reason()).isEqualTo(PrivacyDecision.Reason.GLOBAL_MUTE);
        assertThat(decision.detail()).isEqualTo("away");
    }

    @Test
    void expiredMuteNoLongerRejects() {
        var rules = new PrivacyRuleSet(
                List.of(new PrivacyRuleSet.NodeMute("kitchen", null, NOON.minusSeconds(1), "call")),
                false, null, List.of(), ZoneId.of("UTC"));

        assertThat(PrivacyGate.evaluate(rules, "kitchen", NOON).admitted()).isTrue();
        assertThat(PrivacyGate.evaluate(rules, "kitchen", NOON.minusSeconds(60)).admitted()).isFalse();
    }

    @Test
    void muteCoversOnlyRecordingsInsideItsInterval() {
        var rules = new PrivacyRuleSet(
                List.of(new PrivacyRuleSet.NodeMute("kitchen", NOON, NOON.plusSeconds(1800), "guests")),
                false, null, List.of(), ZoneId.of("UTC"));

        assertThat(PrivacyGate.evaluate(rules, "kitchen", NOON.minusSeconds(1)).admitted()).isTrue();
        assertThat(PrivacyGate.evaluate(rules, "kitchen", NOON).admitted()).isFalse();
        assertThat(PrivacyGate.evaluate(rules, "kitchen", NOON.plusSeconds(1799)).admitted()).isFalse();
        assertThat(PrivacyGate.evaluate(rules, "kitchen", NOON.plusSeconds(1800)).admitted()).isTrue();
    }

    @Test
    void muteOnOtherNodeDoesNotApply() {
        var rules = new PrivacyRuleSet(
                List.of(new PrivacyRuleSet.NodeMute("bedroom", null, null, null)),
                false, null, List.of(), ZoneId.of("UTC"));

        assertThat(PrivacyGate.evaluate(rules, "kitchen", NOON).admitted()).isTrue();
    }

    @Test
    void quietHoursWrapMidnight() {
        var night = new PrivacyRuleSet.QuietWindow(LocalTime.of(22, 0), LocalTime.of(6, 0), "night");
        var rules = new PrivacyRuleSet(List.of(), false, null, List.of(night), ZoneId.of("UTC"));

        assertThat(PrivacyGate.evaluate(rules, "kitchen", Instant.parse("2024-05-01T23:30:00Z")).reason())
                .isEqualTo(PrivacyDecision.Reason.QUIET_HOURS);
        assertThat(PrivacyGate.evaluate(rules, "kitchen", Instant.parse("2024-05-02T05:59:59Z")).admitted()).isFalse();
        assertThat(PrivacyGate.evaluate(rules, "kitchen", Instant.parse("2024-05-02T06:00:00Z")).admitted()).isTrue();
        assertThat(PrivacyGate.evaluate(rules, "kitchen", Instant.parse("2024-05-01T21:59:59Z")).admitted()).isTrue();
    }

    @Test
    void quietHoursEvaluatedInConfiguredZone() {
        // 20:30 UTC is 22:30 in Amsterdam during summer time.
        var night = new PrivacyRuleSet.QuietWindow(LocalTime.of(22, 0), LocalTime.of(23, 0), "late");
        var rules = new PrivacyRuleSet(List.of(), false, null, List.of(night), ZoneId.of("Europe/Amsterdam"));

        assertThat(PrivacyGate.evaluate(rules, "kitchen", Instant.parse("2024-07-01T20:30:00Z")).admitted()).isFalse();
    }

    @Test
    void windowWithEqualBoundsIsEmpty() {
        var window = new PrivacyRuleSet.QuietWindow(LocalTime.of(8, 0), LocalTime.of(8, 0), "none");

        assertThat(window.contains(LocalTime.of(8, 0))).isFalse();
    }
}
