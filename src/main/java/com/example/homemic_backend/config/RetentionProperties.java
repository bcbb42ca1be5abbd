package com.example.homemic_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Controls how long raw audio is kept after capture. Transcripts are never removed by retention.
 */
@ConfigurationProperties(prefix = "homemic.retention")
public class RetentionProperties {
    private boolean enabled = true;
    private int audioMaxAgeDays = 14;
    private int batchSize = 200;
    private String cron = "0 0 3 * * *";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getAudioMaxAgeDays() { return audioMaxAgeDays; }
    public void setAudioMaxAgeDays(int audioMaxAgeDays) { this.audioMaxAgeDays = audioMaxAgeDays; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public String getCron() { return cron; }
    public void setCron(String cron) { this.cron = cron; }
}
