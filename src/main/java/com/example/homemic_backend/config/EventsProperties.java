package com.example.homemic_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Live event fan-out: per-subscriber buffer and heartbeat policy.
 */
@ConfigurationProperties(prefix = "homemic.events")
public class EventsProperties {
    private int subscriberBuffer = 256;
    private long heartbeatIntervalMs = 30_000;
    private int maxMissedHeartbeats = 3;
    private int initialStateSize = 20;

    public int getSubscriberBuffer() { return subscriberBuffer; }
    public void setSubscriberBuffer(int subscriberBuffer) { this.subscriberBuffer = subscriberBuffer; }

    public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }

    public int getMaxMissedHeartbeats() { return maxMissedHeartbeats; }
    public void setMaxMissedHeartbeats(int maxMissedHeartbeats) { this.maxMissedHeartbeats = maxMissedHeartbeats; }

    public int getInitialStateSize() { return initialStateSize; }
    public void setInitialStateSize(int initialStateSize) { this.initialStateSize = initialStateSize; }
}
