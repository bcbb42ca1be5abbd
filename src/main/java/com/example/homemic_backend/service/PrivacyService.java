package com.example.homemic_backend.service;

import com.example.homemic_backend.config.PrivacyProperties;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.PrivacySettings;
import com.example.homemic_backend.model.PrivacyZone;
import com.example.homemic_backend.model.QuietHours;
import com.example.homemic_backend.repository.NodeRepository;
import com.example.homemic_backend.repository.PrivacySettingsRepository;
import com.example.homemic_backend.repository.PrivacyZoneRepository;
import com.example.homemic_backend.repository.QuietHoursRepository;
import com.example.homemic_backend.service.Interfaces.PrivacyRuleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * Owns the mute zones, the global mute flag and quiet-hours windows, and serves them to the
 * {@link PrivacyGate} as a snapshot.
 */
@Service
public class PrivacyService implements PrivacyRuleSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrivacyService.class);

    public record PrivacyStatus(String nodeId,
                                boolean muted,
                                PrivacyDecision.Reason reason,
                                String detail,
                                Instant expiresAt,
                                boolean globalMute) {}

    private final PrivacyZoneRepository zoneRepo;
    private final QuietHoursRepository quietRepo;
    private final PrivacySettingsRepository settingsRepo;
    private final NodeRepository nodeRepo;
    private final PrivacyProperties props;
    private final Clock clock;

    public PrivacyService(PrivacyZoneRepository zoneRepo,
                          QuietHoursRepository quietRepo,
                          PrivacySettingsRepository settingsRepo,
                          NodeRepository nodeRepo,
                          PrivacyProperties props,
                          Clock clock) {
        this.zoneRepo = zoneRepo;
        this.quietRepo = quietRepo;
        this.settingsRepo = settingsRepo;
        this.nodeRepo = nodeRepo;
        this.props = props;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public PrivacyRuleSet currentRules() {
        // Lapsed and lifted zones stay in the snapshot: a clip recorded inside one is still muted.
        List<PrivacyRuleSet.NodeMute> mutes = zoneRepo.findAll().stream()
                .filter(z -> z.getEndTime() == null || z.getEndTime().isAfter(z.getStartTime()))
                .map(z -> new PrivacyRuleSet.NodeMute(z.getNodeId(), z.getStartTime(), z.getEndTime(), z.getReason()))
                .toList();
        List<PrivacyRuleSet.QuietWindow> windows = quietRepo.findByEnabledTrue().stream()
                .map(q -> new PrivacyRuleSet.QuietWindow(q.getStartTime(), q.getEndTime(), q.getLabel()))
                .toList();
        PrivacySettings settings = settingsRepo.findById(PrivacySettings.SINGLETON_ID).orElse(null);
        boolean global = settings != null && settings.isGlobalMute();
        return new PrivacyRuleSet(mutes, global, global ? settings.getGlobalMuteReason() : null, windows, props.getZoneId());
    }

    /**
     * Mutes a node, replacing any mute already in place.
     *
     * @param durationMinutes {@code null} for an indefinite mute
     */
    @Transactional
    public PrivacyZone mute(String nodeId, Integer durationMinutes, String reason) {
        if (!nodeRepo.existsById(nodeId)) {
            throw new NotFoundException("Node", nodeId);
        }
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new IllegalArgumentException("duration_minutes must be positive");
        }
        Instant now = clock.instant();
        close(zoneRepo.findByNodeIdAndActiveTrue(nodeId), now);
        Instant end = durationMinutes == null ? null : now.plus(Duration.ofMinutes(durationMinutes));
        PrivacyZone zone = zoneRepo.save(new PrivacyZone(nodeId, reason, now, end));
        LOGGER.info("PRIVACY mute node={} until={} reason={}", nodeId, end == null ? "indefinite" : end, reason);
        return zone;
    }

    @Transactional
    public int unmute(String nodeId) {
        int closed = close(zoneRepo.findByNodeIdAndActiveTrue(nodeId), clock.instant());
        LOGGER.info("PRIVACY unmute node={} zonesDeactivated={}", nodeId, closed);
        return closed;
    }

    @Transactional
    public PrivacySettings muteAll(String reason) {
        PrivacySettings settings = settingsRepo.findById(PrivacySettings.SINGLETON_ID).orElseGet(PrivacySettings::new);
        settings.mute(reason == null || reason.isBlank() ? "Global mute" : reason, clock.instant());
        LOGGER.info("PRIVACY global mute on reason={}", settings.getGlobalMuteReason());
        return settingsRepo.save(settings);
    }

    /** Clears the global flag and every node mute. */
    @Transactional
    public int unmuteAll() {
        Instant now = clock.instant();
        PrivacySettings settings = settingsRepo.findById(PrivacySettings.SINGLETON_ID).orElseGet(PrivacySettings::new);
        settings.unmute(now);
        settingsRepo.save(settings);
        int closed = close(zoneRepo.findByActiveTrue(), now);
        LOGGER.info("PRIVACY global mute off zonesDeactivated={}", closed);
        return closed;
    }

    /** Deactivates zones and cuts any still-running interval off at {@code now}. */
    private int close(List<PrivacyZone> zones, Instant now) {
        for (PrivacyZone zone : zones) {
            zone.setActive(false);
            if (zone.getEndTime() == null || zone.getEndTime().isAfter(now)) {
                zone.setEndTime(now);
            }
        }
        zoneRepo.saveAll(zones);
        return zones.size();
    }

    @Transactional(readOnly = true)
    public PrivacyStatus status(String nodeId) {
        Instant now = clock.instant();
        PrivacyRuleSet rules = currentRules();
        PrivacyDecision decision = PrivacyGate.evaluate(rules, nodeId, now);
        Instant expiresAt = rules.nodeMutes().stream()
                .filter(m -> m.nodeId().equals(nodeId) && m.appliesAt(now))
                .map(PrivacyRuleSet.NodeMute::expiresAt)
                .findFirst()
                .orElse(null);
        return new PrivacyStatus(nodeId, !decision.admitted(), decision.reason(), decision.detail(), expiresAt, rules.globalMute());
    }

    @Transactional(readOnly = true)
    public List<PrivacyZone> zones(boolean activeOnly) {
        return activeOnly ? zoneRepo.findByActiveTrue() : zoneRepo.findAllByOrderByStartTimeDesc();
    }

    @Transactional(readOnly = true)
    public List<QuietHours> quietHours() {
        return quietRepo.findAllByOrderByStartTimeAsc();
    }

    @Transactional
    public QuietHours addQuietHours(LocalTime start, LocalTime end, String label, boolean enabled) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        QuietHours window = new QuietHours(label, start, end);
        window.setEnabled(enabled);
        LOGGER.info("PRIVACY quiet hours added {}-{} label={}", start, end, label);
        return quietRepo.save(window);
    }

    @Transactional
    public void deleteQuietHours(UUID id) {
        if (!quietRepo.existsById(id)) {
            throw new NotFoundException("Quiet hours", id);
        }
        quietRepo.deleteById(id);
    }

    /** Flags lapsed zones inactive. Their intervals stay in force for clips recorded inside them. */
    @Scheduled(fixedDelayString = "${homemic.privacy.sweep-interval-ms:60000}")
    @Transactional
    public void sweepExpired() {
        int expired = zoneRepo.deactivateExpired(clock.instant());
        if (expired > 0) {
            LOGGER.info("PRIVACY expired mutes deactivated={}", expired);
        }
    }
}
