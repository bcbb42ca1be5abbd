package com.example.homemic_backend.service;

import com.example.homemic_backend.dto.BulkDeleteResponse;
import com.example.homemic_backend.dto.ClipDetailResponse;
import com.example.homemic_backend.dto.ClipSummary;
import com.example.homemic_backend.dto.HistoryResponse;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.model.TranscriptSegment;
import com.example.homemic_backend.service.Interfaces.AudioStorage;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import com.example.homemic_backend.service.events.ClipReceivedEvent;
import com.example.homemic_backend.util.ClipStatus;
import com.example.homemic_backend.util.ExportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read and edit operations behind {@code /api/batch}. Pipeline state is only ever changed
 * through {@link ClipStore}.
 */
@Service
public class ClipService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipService.class);

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;
    public static final int MAX_RECENT_MINUTES = 60;

    private final ClipStore store;
    private final AudioStorage storage;
    private final TranscriptExporter exporter;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ClipService(ClipStore store,
                       AudioStorage storage,
                       TranscriptExporter exporter,
                       ApplicationEventPublisher publisher,
                       Clock clock) {
        this.store = store;
        this.storage = storage;
        this.exporter = exporter;
        this.publisher = publisher;
        this.clock = clock;
    }

    public HistoryResponse history(String nodeId, ClipStatus status, Instant from, Instant to, String search,
                                   int offset, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        Page<Clip> page = store.history(new ClipStore.HistoryQuery(
                blankToNull(nodeId), status, from, to, blankToNull(search), offset, limit));
        List<ClipSummary> clips = page.getContent().stream().map(ClipSummary::from).toList();
        return new HistoryResponse(page.getTotalElements(), offset, limit, clips);
    }

    /** Transcripts finished in the last {@code minutes}, newest first. */
    public List<ClipSummary> recent(int minutes) {
        if (minutes < 1 || minutes > MAX_RECENT_MINUTES) {
            throw new IllegalArgumentException("minutes must be between 1 and " + MAX_RECENT_MINUTES);
        }
        Instant since = clock.instant().minus(Duration.ofMinutes(minutes));
        return store.recentTranscribed(since, MAX_LIMIT).stream().map(ClipSummary::from).toList();
    }

    public ClipDetailResponse detail(UUID clipId) {
        Clip clip = store.require(clipId);
        return ClipDetailResponse.from(clip, store.segments(clipId));
    }

    /** Local file for the clip's audio; 404 once retention has removed it. */
    public Path audio(UUID clipId) {
        Clip clip = store.require(clipId);
        if (clip.isAudioDeleted() || clip.getObjectKey() == null || !storage.exists(clip.getObjectKey())) {
            throw new NotFoundException("Audio", clipId);
        }
        return storage.resolve(clip.getObjectKey());
    }

    public ClipDetailResponse updateMetadata(UUID clipId, String displayName, String notes) {
        Clip clip = store.updateMetadata(clipId, displayName, notes);
        return ClipDetailResponse.from(clip, store.segments(clipId));
    }

    public void delete(UUID clipId, boolean deleteFile) {
        store.require(clipId);
        List<ClipStore.DeletedClip> deleted = store.delete(List.of(clipId));
        if (deleteFile) {
            removeBlobs(deleted);
        }
    }

    /** Unknown ids are skipped. Blob removal is best effort and never undoes the row deletion. */
    public BulkDeleteResponse bulkDelete(List<UUID> clipIds) {
        List<ClipStore.DeletedClip> deleted = store.delete(new LinkedHashSet<>(clipIds));
        int removed = removeBlobs(deleted);
        return new BulkDeleteResponse(deleted.size(), deleted.stream().map(ClipStore.DeletedClip::id).toList(), removed);
    }

    public ClipDetailResponse retry(UUID clipId) {
        Clip clip = store.retry(clipId);
        publisher.publishEvent(new ClipReceivedEvent(clip.getId(), clip.getNodeId()));
        LOGGER.info("RETRY queued clipId={} node={}", clip.getId(), clip.getNodeId());
        return ClipDetailResponse.from(clip, List.of());
    }

    public TranscriptExporter.ExportDocument export(UUID clipId, ExportFormat format) {
        return exporter.export(detail(clipId), format);
    }

    /** Clips come back in request order; unknown ids are skipped. */
    public TranscriptExporter.ExportDocument bulkExport(List<UUID> clipIds, ExportFormat format) {
        List<ClipDetailResponse> details = details(new ArrayList<>(new LinkedHashSet<>(clipIds)));
        return exporter.exportAll(details, format);
    }

    private List<ClipDetailResponse> details(List<UUID> clipIds) {
        Map<UUID, List<TranscriptSegment>> byClip = store.segments(clipIds).stream()
                .collect(Collectors.groupingBy(s -> s.getClip().getId()));
        List<ClipDetailResponse> out = new ArrayList<>(clipIds.size());
        for (UUID id : clipIds) {
            store.find(id).ifPresent(clip -> out.add(ClipDetailResponse.from(clip, byClip.getOrDefault(id, List.of()))));
        }
        return out;
    }

    private int removeBlobs(List<ClipStore.DeletedClip> deleted) {
        int removed = 0;
        for (ClipStore.DeletedClip d : deleted) {
            if (d.objectKey() == null) {
                continue;
            }
            try {
                storage.delete(d.objectKey());
                removed++;
            } catch (RuntimeException e) {
                LOGGER.warn("Audio delete failed clipId={} key={} err={}", d.id(), d.objectKey(), e.toString());
            }
        }
        return removed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
