package com.example.homemic_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * A mute on one node. {@code endTime == null} means indefinite.
 */
@Entity
@Table(
        name = "privacy_zone",
        indexes = {
                @Index(name = "idx_privacy_zone_node_active", columnList = "node_id, active")
        }
)
public class PrivacyZone {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "node_id", nullable = false, length = 64)
    private String nodeId;

    @Column(name = "reason")
    private String reason;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    protected PrivacyZone() {}

    public PrivacyZone(String nodeId, String reason, Instant startTime, Instant endTime) {
        this.nodeId = nodeId;
        this.reason = reason;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public UUID getId() { return id; }
    public String getNodeId() { return nodeId; }
    public String getReason() { return reason; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
