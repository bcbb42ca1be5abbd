package com.example.homemic_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "homemic.health")
public class HealthProperties {
    private Duration freshnessWindow = Duration.ofMinutes(5);
    private double latencyWarningMs = 500;
    private long sweepIntervalMs = 30_000;

    public Duration getFreshnessWindow() { return freshnessWindow; }
    public void setFreshnessWindow(Duration freshnessWindow) { this.freshnessWindow = freshnessWindow; }

    public double getLatencyWarningMs() { return latencyWarningMs; }
    public void setLatencyWarningMs(double latencyWarningMs) { this.latencyWarningMs = latencyWarningMs; }

    public long getSweepIntervalMs() { return sweepIntervalMs; }
    public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
}
