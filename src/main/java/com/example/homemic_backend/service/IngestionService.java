package com.example.homemic_backend.service;

import com.example.homemic_backend.config.IngestProperties;
import com.example.homemic_backend.exception.ClipTooLargeException;
import com.example.homemic_backend.exception.ClipValidationException;
import com.example.homemic_backend.exception.StorageFailureException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.service.Interfaces.AudioStorage;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import com.example.homemic_backend.service.events.ClipReceivedEvent;
import com.example.homemic_backend.util.WavDuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Accepts clips from nodes. Validation happens before anything is written; the blob is written
 * before the row, so a storage failure never leaves a row pointing at missing audio.
 */
@Service
public class IngestionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionService.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    public record ClipUpload(String nodeId,
                             String filename,
                             byte[] audio,
                             Instant recordedAt,
                             Double durationSeconds,
                             String remoteAddress) {}

    private final ClipStore store;
    private final AudioStorage storage;
    private final PrivacyGate gate;
    private final NodeHealthMonitor health;
    private final ApplicationEventPublisher publisher;
    private final IngestProperties props;
    private final Clock clock;

    public IngestionService(ClipStore store,
                            AudioStorage storage,
                            PrivacyGate gate,
                            NodeHealthMonitor health,
                            ApplicationEventPublisher publisher,
                            IngestProperties props,
                            Clock clock) {
        this.store = store;
        this.storage = storage;
        this.gate = gate;
        this.health = health;
        this.publisher = publisher;
        this.props = props;
        this.clock = clock;
    }

    public Clip upload(ClipUpload upload) {
        String nodeId = upload.nodeId() == null ? null : upload.nodeId().trim();
        if (nodeId == null || !NodeService.NODE_ID.matcher(nodeId).matches()) {
            throw new ClipValidationException("node_id", "node_id must match " + NodeService.NODE_ID.pattern());
        }
        byte[] audio = upload.audio();
        if (audio == null || audio.length == 0) {
            throw new ClipValidationException("audio", "audio is empty");
        }
        long max = props.getMaxFileSize().toBytes();
        if (audio.length > max) {
            throw new ClipTooLargeException(max);
        }
        double duration = resolveDuration(upload.durationSeconds(), audio);
        Instant now = clock.instant();
        Instant recordedAt = upload.recordedAt() == null ? now : upload.recordedAt();
        String filename = sanitizeFilename(upload.filename(), recordedAt);

        health.recordContact(nodeId, null, upload.remoteAddress());

        PrivacyDecision decision = gate.check(nodeId, recordedAt);

        UUID clipId = UUID.randomUUID();
        String objectKey = nodeId + "/" + DAY.format(recordedAt) + "/" + clipId + "-" + filename;
        storage.write(objectKey, audio);

        Clip clip;
        try {
            clip = store.create(new ClipStore.NewClip(clipId, nodeId, filename, objectKey, audio.length, duration,
                    recordedAt, now, !decision.admitted()));
        } catch (RuntimeException e) {
            try {
                storage.delete(objectKey);
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StorageFailureException("Could not record clip for node " + nodeId, e);
        }

        if (decision.admitted()) {
            LOGGER.info("UPLOAD accepted clipId={} node={} bytes={} duration={}s", clipId, nodeId, audio.length, duration);
            publisher.publishEvent(new ClipReceivedEvent(clipId, nodeId));
        } else {
            LOGGER.info("UPLOAD suppressed clipId={} node={} reason={} detail={}", clipId, nodeId, decision.reason(), decision.detail());
        }
        return clip;
    }

    private static double resolveDuration(Double declared, byte[] audio) {
        if (declared != null) {
            if (declared.isNaN() || declared.isInfinite() || declared <= 0) {
                throw new ClipValidationException("duration_seconds", "duration_seconds must be > 0");
            }
            return declared;
        }
        OptionalDouble fromHeader = WavDuration.of(audio);
        if (fromHeader.isEmpty()) {
            throw new ClipValidationException("duration_seconds", "duration_seconds is required for non-WAV audio");
        }
        return fromHeader.getAsDouble();
    }

    static String sanitizeFilename(String raw, Instant recordedAt) {
        String name = raw == null ? "" : raw.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isBlank() || name.chars().allMatch(c -> c == '.')) {
            return "clip_" + recordedAt.getEpochSecond() + ".wav";
        }
        return name.length() > 128 ? name.substring(name.length() - 128) : name;
    }
}
