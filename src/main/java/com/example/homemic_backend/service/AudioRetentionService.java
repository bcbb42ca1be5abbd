package com.example.homemic_backend.service;

import com.example.homemic_backend.config.RetentionProperties;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.service.Interfaces.AudioStorage;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Removes raw audio once it is older than the retention window. Transcripts, segments and the
 * clip row stay; the clip is flagged so the audio endpoint answers 404.
 */
@Service
public class AudioRetentionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AudioRetentionService.class);

    private final ClipStore store;
    private final AudioStorage storage;
    private final RetentionProperties properties;
    private final Clock clock;

    public AudioRetentionService(ClipStore store, AudioStorage storage, RetentionProperties properties, Clock clock) {
        this.store = store;
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${homemic.retention.cron:0 0 3 * * *}")
    public void scheduledCleanup() {
        if (!properties.isEnabled()) {
            return;
        }
        purgeExpiredAudio();
    }

    /** @return number of clips whose audio was released */
    public int purgeExpiredAudio() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(1, properties.getAudioMaxAgeDays())));
        int batch = Math.max(1, properties.getBatchSize());
        int released = 0;
        while (true) {
            List<Clip> expired = store.findAudioOlderThan(cutoff, batch);
            if (expired.isEmpty()) {
                break;
            }
            int failed = 0;
            for (Clip clip : expired) {
                try {
                    storage.delete(clip.getObjectKey());
                } catch (RuntimeException e) {
                    LOGGER.warn("RETENTION delete failed clipId={} key={} err={}", clip.getId(), clip.getObjectKey(), e.toString());
                    failed++;
                    continue;
                }
                store.markAudioDeleted(clip.getId());
                released++;
            }
            if (failed == expired.size() || expired.size() < batch) {
                break;
            }
        }
        if (released > 0) {
            LOGGER.info("RETENTION released audio clips={} cutoff={}", released, cutoff);
        }
        return released;
    }
}
