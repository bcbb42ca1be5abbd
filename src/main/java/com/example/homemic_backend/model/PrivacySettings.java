package com.example.homemic_backend.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Single-row table holding the global mute flag.
 */
@Entity
@Table(name = "privacy_settings")
public class PrivacySettings {
    public static final long SINGLETON_ID = 1L;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id = SINGLETON_ID;

    @Column(name = "global_mute", nullable = false)
    private boolean globalMute;

    @Column(name = "global_mute_reason")
    private String globalMuteReason;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PrivacySettings() {}

    public Long getId() { return id; }
    public boolean isGlobalMute() { return globalMute; }
    public String getGlobalMuteReason() { return globalMuteReason; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void mute(String reason, Instant at) {
        this.globalMute = true;
        this.globalMuteReason = reason;
        this.updatedAt = at;
    }

    public void unmute(Instant at) {
        this.globalMute = false;
        this.globalMuteReason = null;
        this.updatedAt = at;
    }
}
