package com.example.homemic_backend.service.Interfaces;

import com.example.homemic_backend.exception.LeaseExpiredException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.model.TranscriptSegment;
import com.example.homemic_backend.service.RetryPolicy;
import com.example.homemic_backend.util.ClipStatus;
import org.springframework.data.domain.Page;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single source of truth for clip state. Every status change goes through here and is guarded
 * so that conflicting writers cannot both win.
 */
public interface ClipStore {

    record NewClip(UUID id,
                   String nodeId,
                   String filename,
                   String objectKey,
                   long fileSize,
                   double durationSeconds,
                   Instant recordedAt,
                   Instant uploadedAt,
                   boolean privacySuppressed) {}

    record ClipLease(UUID clipId, UUID leaseId, int attempt, Instant expiresAt) {}

    record SegmentDraft(double startTime, double endTime, String text, double confidence) {}

    record TranscriptOutcome(List<SegmentDraft> segments, String text, int wordCount, long processingDurationMs) {}

    record FailureOutcome(boolean terminal, int attempts, Instant nextAttemptAt) {}

    /** {@code search} is a case-insensitive substring of the transcript text. */
    record HistoryQuery(String nodeId, ClipStatus status, Instant from, Instant to, String search, int offset, int limit) {}

    record DeletedClip(UUID id, String nodeId, String objectKey) {}

    /** Inserts the row; suppressed clips are created directly as failed. */
    Clip create(NewClip clip);

    Optional<Clip> find(UUID clipId);

    Clip require(UUID clipId);

    List<TranscriptSegment> segments(UUID clipId);

    List<TranscriptSegment> segments(Collection<UUID> clipIds);

    /** Pending clips whose backoff has elapsed, oldest recording first. */
    List<UUID> findReady(int limit, Instant now);

    /** Compare-and-swap {@code pending -> processing}. Empty when another worker won. */
    Optional<ClipLease> tryClaim(UUID clipId, Duration ttl, Instant now);

    /** Extends the lease. Empty when it has already expired or been taken over. */
    Optional<ClipLease> renew(ClipLease lease, Duration ttl, Instant now);

    /** Returns abandoned {@code processing} clips to {@code pending}; yields their ids. */
    List<UUID> releaseExpiredLeases(Instant now);

    /**
     * Writes the segments and flips the clip to {@code transcribed} in one transaction.
     *
     * @throws LeaseExpiredException if the lease is no longer held; nothing is written
     */
    void complete(ClipLease lease, TranscriptOutcome outcome, Instant now);

    /**
     * @throws LeaseExpiredException if the lease is no longer held
     */
    FailureOutcome recordFailure(ClipLease lease, String errorMessage, RetryPolicy policy, Instant now);

    /** Manual {@code failed -> pending}. Attempts start over. */
    Clip retry(UUID clipId);

    Clip updateMetadata(UUID clipId, String displayName, String notes);

    Page<Clip> history(HistoryQuery query);

    /** Clips transcribed at or after {@code since}, most recent first. */
    List<Clip> recentTranscribed(Instant since, int limit);

    List<DeletedClip> delete(Collection<UUID> clipIds);

    TranscriptSegment reassignSpeaker(UUID segmentId, UUID speakerId);

    List<Clip> findAudioOlderThan(Instant cutoff, int limit);

    void markAudioDeleted(UUID clipId);
}
