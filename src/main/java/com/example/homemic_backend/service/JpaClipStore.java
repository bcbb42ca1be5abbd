package com.example.homemic_backend.service;

import com.example.homemic_backend.exception.ClipNotFoundException;
import com.example.homemic_backend.exception.IllegalClipStateException;
import com.example.homemic_backend.exception.LeaseExpiredException;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.model.Speaker;
import com.example.homemic_backend.model.TranscriptSegment;
import com.example.homemic_backend.repository.ClipRepository;
import com.example.homemic_backend.repository.KeywordDetectionRepository;
import com.example.homemic_backend.repository.NodeRepository;
import com.example.homemic_backend.repository.OffsetLimitRequest;
import com.example.homemic_backend.repository.SpeakerRepository;
import com.example.homemic_backend.repository.TranscriptSegmentRepository;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import com.example.homemic_backend.util.ClipStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class JpaClipStore implements ClipStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaClipStore.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final ClipRepository clipRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final KeywordDetectionRepository detectionRepo;
    private final NodeRepository nodeRepo;
    private final SpeakerRepository speakerRepo;

    public JpaClipStore(ClipRepository clipRepo,
                        TranscriptSegmentRepository segmentRepo,
                        KeywordDetectionRepository detectionRepo,
                        NodeRepository nodeRepo,
                        SpeakerRepository speakerRepo) {
        this.clipRepo = clipRepo;
        this.segmentRepo = segmentRepo;
        this.detectionRepo = detectionRepo;
        this.nodeRepo = nodeRepo;
        this.speakerRepo = speakerRepo;
    }

    @Override
    @Transactional
    public Clip create(NewClip draft) {
        Node node = nodeRepo.getReferenceById(draft.nodeId());
        Clip clip = new Clip(draft.id(), node, draft.filename(), draft.objectKey(), draft.fileSize(),
                draft.durationSeconds(), draft.recordedAt(), draft.uploadedAt());
        if (draft.privacySuppressed()) {
            clip.suppress();
        }
        return clipRepo.saveAndFlush(clip);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Clip> find(UUID clipId) {
        return clipRepo.findById(clipId);
    }

    @Override
    @Transactional(readOnly = true)
    public Clip require(UUID clipId) {
        return clipRepo.findById(clipId).orElseThrow(() -> new ClipNotFoundException(clipId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TranscriptSegment> segments(UUID clipId) {
        return segmentRepo.findForClip(clipId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TranscriptSegment> segments(Collection<UUID> clipIds) {
        if (clipIds.isEmpty()) {
            return List.of();
        }
        return segmentRepo.findForClips(clipIds);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findReady(int limit, Instant now) {
        return clipRepo.findReadyIds(ClipStatus.PENDING, now, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional
    public Optional<ClipLease> tryClaim(UUID clipId, Duration ttl, Instant now) {
        UUID leaseId = UUID.randomUUID();
        Instant expiresAt = now.plus(ttl);
        int updated = clipRepo.claim(clipId, leaseId, expiresAt, now, ClipStatus.PENDING, ClipStatus.PROCESSING);
        if (updated == 0) {
            return Optional.empty();
        }
        int attempt = clipRepo.findById(clipId).map(Clip::getAttempts).orElse(1);
        LOGGER.info("CLAIM clipId={} lease={} attempt={} expiresAt={}", clipId, leaseId, attempt, expiresAt);
        return Optional.of(new ClipLease(clipId, leaseId, attempt, expiresAt));
    }

    @Override
    @Transactional
    public Optional<ClipLease> renew(ClipLease lease, Duration ttl, Instant now) {
        Instant expiresAt = now.plus(ttl);
        int updated = clipRepo.renew(lease.clipId(), lease.leaseId(), expiresAt, now, ClipStatus.PROCESSING);
        if (updated == 0) {
            return Optional.empty();
        }
        return Optional.of(new ClipLease(lease.clipId(), lease.leaseId(), lease.attempt(), expiresAt));
    }

    @Override
    @Transactional
    public List<UUID> releaseExpiredLeases(Instant now) {
        List<UUID> expired = clipRepo.findExpiredLeaseIds(ClipStatus.PROCESSING, now);
        if (expired.isEmpty()) {
            return List.of();
        }
        int released = clipRepo.releaseExpired(now, ClipStatus.PROCESSING, ClipStatus.PENDING);
        LOGGER.warn("LEASE expired released={} clipIds={}", released, expired);
        return expired;
    }

    @Override
    @Transactional
    public void complete(ClipLease lease, TranscriptOutcome outcome, Instant now) {
        int updated = clipRepo.complete(lease.clipId(), lease.leaseId(), outcome.text(), outcome.wordCount(),
                outcome.processingDurationMs(), now, ClipStatus.PROCESSING, ClipStatus.TRANSCRIBED);
        if (updated == 0) {
            throw new LeaseExpiredException(lease.clipId(), lease.leaseId());
        }
        // Nothing should be there: a clip only gets segments together with this status flip.
        int stale = segmentRepo.deleteByClipId(lease.clipId());
        if (stale > 0) {
            LOGGER.warn("Removed {} stale segments for clipId={}", stale, lease.clipId());
        }
        Clip ref = clipRepo.getReferenceById(lease.clipId());
        List<TranscriptSegment> rows = new ArrayList<>(outcome.segments().size());
        for (SegmentDraft s : outcome.segments()) {
            rows.add(new TranscriptSegment(ref, s.startTime(), s.endTime(), s.text(), s.confidence()));
        }
        segmentRepo.saveAll(rows);
    }

    @Override
    @Transactional
    public FailureOutcome recordFailure(ClipLease lease, String errorMessage, RetryPolicy policy, Instant now) {
        boolean terminal = policy.exhausted(lease.attempt());
        Instant nextAttemptAt = terminal ? null : now.plus(policy.delayAfter(lease.attempt()));
        int updated = clipRepo.fail(lease.clipId(), lease.leaseId(), truncate(errorMessage), nextAttemptAt,
                terminal ? now : null, ClipStatus.PROCESSING, terminal ? ClipStatus.FAILED : ClipStatus.PENDING);
        if (updated == 0) {
            throw new LeaseExpiredException(lease.clipId(), lease.leaseId());
        }
        return new FailureOutcome(terminal, lease.attempt(), nextAttemptAt);
    }

    @Override
    @Transactional
    public Clip retry(UUID clipId) {
        Clip clip = require(clipId);
        if (clip.isPrivacySuppressed()) {
            throw new IllegalClipStateException(clipId, clip.getStatus(), "Clip was suppressed by a privacy rule and cannot be retried");
        }
        if (clip.getStatus() != ClipStatus.FAILED) {
            throw new IllegalClipStateException(clipId, clip.getStatus(), "Only failed clips can be retried (status=" + clip.getStatus().wire() + ")");
        }
        clip.setStatus(ClipStatus.PENDING);
        clip.setAttempts(0);
        clip.setNextAttemptAt(null);
        clip.setErrorMessage(null);
        return clipRepo.saveAndFlush(clip);
    }

    @Override
    @Transactional
    public Clip updateMetadata(UUID clipId, String displayName, String notes) {
        Clip clip = require(clipId);
        if (displayName != null) {
            clip.setDisplayName(displayName.isBlank() ? null : displayName.trim());
        }
        if (notes != null) {
            clip.setNotes(notes.isBlank() ? null : notes);
        }
        return clipRepo.saveAndFlush(clip);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Clip> history(HistoryQuery q) {
        var pageable = new OffsetLimitRequest(q.offset(), q.limit(), Sort.by(Sort.Direction.DESC, "recordedAt"));
        return clipRepo.search(q.nodeId(), q.status(), q.from(), q.to(), likePattern(q.search()), pageable);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Clip> recentTranscribed(Instant since, int limit) {
        return clipRepo.findByStatusAndProcessedAtGreaterThanEqualOrderByProcessedAtDesc(
                ClipStatus.TRANSCRIBED, since, PageRequest.of(0, limit));
    }

    static String likePattern(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String escaped = search.trim().toLowerCase(Locale.ROOT)
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return "%" + escaped + "%";
    }

    @Override
    @Transactional
    public List<DeletedClip> delete(Collection<UUID> clipIds) {
        List<Clip> clips = clipRepo.findAllById(clipIds);
        List<DeletedClip> deleted = new ArrayList<>(clips.size());
        for (Clip clip : clips) {
            deleted.add(new DeletedClip(clip.getId(), clip.getNodeId(), clip.isAudioDeleted() ? null : clip.getObjectKey()));
        }
        for (DeletedClip d : deleted) {
            detectionRepo.deleteByClipId(d.id());
            segmentRepo.deleteByClipId(d.id());
        }
        clipRepo.deleteAllByIdInBatch(deleted.stream().map(DeletedClip::id).toList());
        LOGGER.info("Deleted clips count={} ids={}", deleted.size(), deleted.stream().map(DeletedClip::id).toList());
        return deleted;
    }

    @Override
    @Transactional
    public TranscriptSegment reassignSpeaker(UUID segmentId, UUID speakerId) {
        TranscriptSegment segment = segmentRepo.findWithClip(segmentId)
                .orElseThrow(() -> new NotFoundException("Segment", segmentId));
        Speaker speaker = null;
        if (speakerId != null) {
            speaker = speakerRepo.findById(speakerId)
                    .orElseThrow(() -> new NotFoundException("Speaker", speakerId));
        }
        segment.setSpeaker(speaker);
        return segmentRepo.saveAndFlush(segment);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Clip> findAudioOlderThan(Instant cutoff, int limit) {
        return clipRepo.findAudioOlderThan(cutoff, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional
    public void markAudioDeleted(UUID clipId) {
        clipRepo.findById(clipId).ifPresent(clip -> {
            clip.setAudioDeleted(true);
            clip.setObjectKey(null);
            clipRepo.save(clip);
        });
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
