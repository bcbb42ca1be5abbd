package com.example.homemic_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "homemic.privacy")
public class PrivacyProperties {
    /** Zone in which quiet-hours windows are interpreted. */
    private ZoneId zoneId = ZoneId.of("UTC");
    private long sweepIntervalMs = 60_000;

    public ZoneId getZoneId() { return zoneId; }
    public void setZoneId(ZoneId zoneId) { this.zoneId = zoneId; }

    public long getSweepIntervalMs() { return sweepIntervalMs; }
    public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
}
