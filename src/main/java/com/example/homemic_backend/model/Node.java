package com.example.homemic_backend.model;

import com.example.homemic_backend.util.NodeStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A capture device. Registered on first contact and only ever soft-disabled.
 */
@Entity
@Table(name = "node")
public class Node {
    // Weight of the newest sample in the rolling latency average.
    private static final double LATENCY_ALPHA = 0.3;

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "location", nullable = false)
    private String location;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private NodeStatus status = NodeStatus.OFFLINE;

    @Column(name = "audio_filtering", nullable = false)
    private boolean audioFiltering = true;

    @Column(name = "latency_ms", nullable = false)
    private double latencyMs;

    @Column(name = "last_seen")
    private Instant lastSeen;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    protected Node() {}

    public Node(String id, String name, String location) {
        this.id = id;
        this.name = name;
        this.location = location;
    }

    public static Node register(String id) {
        return new Node(id, id, id);
    }

    /**
     * Records a contact from the node. A {@code null} latency leaves the rolling average untouched.
     */
    public void touch(Instant at, Double latencySampleMs) {
        if (latencySampleMs != null && latencySampleMs >= 0) {
            this.latencyMs = lastSeen == null
                    ? latencySampleMs
                    : LATENCY_ALPHA * latencySampleMs + (1 - LATENCY_ALPHA) * latencyMs;
        }
        this.lastSeen = at;
        this.enabled = true;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public String getIpAddress() { return ipAddress; }
    public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }
    public NodeStatus getStatus() { return status; }
    public void setStatus(NodeStatus status) { this.status = status; }
    public boolean isAudioFiltering() { return audioFiltering; }
    public void setAudioFiltering(boolean audioFiltering) { this.audioFiltering = audioFiltering; }
    public double getLatencyMs() { return latencyMs; }
    public void setLatencyMs(double latencyMs) { this.latencyMs = latencyMs; }
    public Instant getLastSeen() { return lastSeen; }
    public void setLastSeen(Instant lastSeen) { this.lastSeen = lastSeen; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public Long getVersion() { return version; }
}
