package com.example.homemic_backend.service;

import com.example.homemic_backend.config.WorkerProperties;
import com.example.homemic_backend.engine.Interfaces.Transcriber;
import com.example.homemic_backend.exception.LeaseExpiredException;
import com.example.homemic_backend.exception.StorageFailureException;
import com.example.homemic_backend.exception.TranscriptionException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.service.Interfaces.AudioStorage;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import com.example.homemic_backend.service.Interfaces.ClipStore.ClipLease;
import com.example.homemic_backend.service.Interfaces.ClipStore.FailureOutcome;
import com.example.homemic_backend.service.Interfaces.ClipStore.SegmentDraft;
import com.example.homemic_backend.service.Interfaces.ClipStore.TranscriptOutcome;
import com.example.homemic_backend.service.events.ClipFailedEvent;
import com.example.homemic_backend.service.events.ClipReceivedEvent;
import com.example.homemic_backend.service.events.EventBus;
import com.example.homemic_backend.service.events.KeywordDetectedEvent;
import com.example.homemic_backend.service.events.TranscriptionEvent;
import com.example.homemic_backend.util.TranscriptUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives clips through {@code pending -> processing -> transcribed | failed}. A clip is only
 * worked on under a lease obtained by compare-and-swap; the lease is renewed while the engine
 * runs and, if it is lost, the result is thrown away and the next claimant starts over.
 */
@Service
public class TranscriptionCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionCoordinator.class);
    private static final Duration MIN_RENEW_PERIOD = Duration.ofSeconds(1);

    private final ClipStore store;
    private final AudioStorage storage;
    private final Transcriber transcriber;
    private final SegmentNormalizer normalizer;
    private final KeywordService keywords;
    private final EventBus events;
    private final Executor workerExecutor;
    private final TaskScheduler taskScheduler;
    private final WorkerProperties props;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private final Semaphore permits;
    private final ReentrantLock pollLock = new ReentrantLock();

    public TranscriptionCoordinator(ClipStore store,
                                    AudioStorage storage,
                                    Transcriber transcriber,
                                    SegmentNormalizer normalizer,
                                    KeywordService keywords,
                                    EventBus events,
                                    @Qualifier("workerTaskExecutor") Executor workerExecutor,
                                    TaskScheduler taskScheduler,
                                    WorkerProperties props,
                                    Clock clock) {
        this.store = store;
        this.storage = storage;
        this.transcriber = transcriber;
        this.normalizer = normalizer;
        this.keywords = keywords;
        this.events = events;
        this.workerExecutor = workerExecutor;
        this.taskScheduler = taskScheduler;
        this.props = props;
        this.retryPolicy = RetryPolicy.from(props);
        this.clock = clock;
        this.permits = new Semaphore(Math.max(1, props.getPoolSize()));
    }

    @Scheduled(fixedDelayString = "${homemic.worker.poll-interval-ms:3000}")
    public void poll() {
        if (!props.isEnabled() || !pollLock.tryLock()) {
            return;
        }
        try {
            Instant now = clock.instant();
            store.releaseExpiredLeases(now);

            int free = permits.availablePermits();
            if (free == 0) {
                LOGGER.debug("Worker poll tick - all {} workers busy", props.getPoolSize());
                return;
            }
            List<UUID> ready = store.findReady(Math.min(free, Math.max(1, props.getPollBatchSize())), now);
            if (ready.isEmpty()) {
                LOGGER.debug("Worker poll tick - no clips ready");
                return;
            }
            for (UUID clipId : ready) {
                if (!permits.tryAcquire()) {
                    break;
                }
                Optional<ClipLease> lease;
                try {
                    lease = store.tryClaim(clipId, props.getLeaseTtl(), clock.instant());
                } catch (RuntimeException e) {
                    permits.release();
                    LOGGER.warn("CLAIM failed clipId={} err={}", clipId, e.toString());
                    continue;
                }
                if (lease.isEmpty()) {
                    permits.release();
                    LOGGER.debug("CLAIM lost race clipId={}", clipId);
                    continue;
                }
                submit(lease.get());
            }
        } finally {
            pollLock.unlock();
        }
    }

    /**
     * Wakes the poller as soon as a clip is admitted instead of waiting for the next tick.
     */
    @EventListener
    public void onClipReceived(ClipReceivedEvent event) {
        if (!props.isEnabled()) {
            return;
        }
        LOGGER.debug("Clip received clipId={} node={} - scheduling poll", event.clipId(), event.nodeId());
        taskScheduler.schedule(this::poll, clock.instant());
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    private void submit(ClipLease lease) {
        try {
            workerExecutor.execute(() -> {
                try {
                    process(lease);
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            // The claim stays until its lease runs out, then the clip is picked up again.
            LOGGER.warn("Worker queue full, clipId={} will be reclaimed after lease expiry", lease.clipId());
        }
    }

    void process(ClipLease lease) {
        LeaseKeeper keeper = new LeaseKeeper(lease);
        keeper.start();
        long t0 = System.nanoTime();
        Clip clip = null;
        try {
            clip = store.require(lease.clipId());
            LOGGER.info("TRANSCRIBE START clipId={} node={} attempt={}", clip.getId(), clip.getNodeId(), lease.attempt());
            byte[] audio = storage.read(clip.getObjectKey());
            Transcriber.Result result = transcriber.transcribe(
                    new Transcriber.Request(clip.getId(), audio, clip.getFilename(), clip.getDurationSeconds()));

            if (keeper.isLost()) {
                LOGGER.warn("LEASE lost during transcription clipId={} - discarding result", clip.getId());
                return;
            }
            List<SegmentDraft> segments = normalizer.normalize(result.segments(), clip.getDurationSeconds());
            String text = SegmentNormalizer.joinText(segments);
            int wordCount = TranscriptUtil.wordCount(text);
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

            keeper.stop();
            Instant now = clock.instant();
            store.complete(keeper.current(), new TranscriptOutcome(segments, text, wordCount, elapsedMs), now);
            LOGGER.info("TRANSCRIBE DONE clipId={} segments={} words={} provider={} in={}ms",
                    clip.getId(), segments.size(), wordCount, result.provider(), elapsedMs);

            List<KeywordDetectedEvent> hits = matchKeywords(clip, text);
            events.publish(new TranscriptionEvent(clip.getId(), clip.getNodeId(), text, wordCount, segments.size(),
                    clip.getDurationSeconds(), clip.getRecordedAt(), now));
            hits.forEach(events::publish);
        } catch (LeaseExpiredException e) {
            LOGGER.warn("LEASE expired before commit clipId={} - another worker will retry", lease.clipId());
        } catch (Exception e) {
            handleFailure(keeper, clip, e);
        } finally {
            keeper.stop();
        }
    }

    private List<KeywordDetectedEvent> matchKeywords(Clip clip, String text) {
        try {
            return keywords.recordMatches(clip.getId(), clip.getNodeId(), text);
        } catch (RuntimeException e) {
            // The transcript is already committed; a keyword failure must not turn it into a failed clip.
            LOGGER.error("Keyword matching failed clipId={}: {}", clip.getId(), e.toString(), e);
            return List.of();
        }
    }

    private void handleFailure(LeaseKeeper keeper, Clip clip, Exception error) {
        UUID clipId = keeper.current().clipId();
        if (keeper.isLost()) {
            LOGGER.warn("TRANSCRIBE failed after lease loss clipId={} err={}", clipId, error.toString());
            return;
        }
        String message = describe(error);
        LOGGER.error("TRANSCRIBE FAILED clipId={} attempt={} err={}", clipId, keeper.current().attempt(), message, error);
        keeper.stop();
        FailureOutcome outcome;
        try {
            outcome = store.recordFailure(keeper.current(), message, retryPolicy, clock.instant());
        } catch (LeaseExpiredException e) {
            LOGGER.warn("LEASE expired before failure was recorded clipId={}", clipId);
            return;
        }
        if (outcome.terminal()) {
            LOGGER.warn("Clip {} failed permanently after {} attempts", clipId, outcome.attempts());
            events.publish(new ClipFailedEvent(clipId, clip == null ? null : clip.getNodeId(), message,
                    outcome.attempts(), clock.instant()));
        } else {
            LOGGER.info("Clip {} back to pending, next attempt at {}", clipId, outcome.nextAttemptAt());
        }
    }

    private static String describe(Exception e) {
        if (e instanceof TranscriptionException || e instanceof StorageFailureException) {
            return e.getMessage();
        }
        return e.toString();
    }

    /**
     * Renews one lease at a third of its TTL until stopped or until a renewal is refused.
     */
    private final class LeaseKeeper {
        private volatile ClipLease current;
        private volatile boolean lost;
        private volatile ScheduledFuture<?> future;

        LeaseKeeper(ClipLease lease) {
            this.current = lease;
        }

        void start() {
            Duration period = props.getLeaseTtl().dividedBy(3);
            if (period.compareTo(MIN_RENEW_PERIOD) < 0) {
                period = MIN_RENEW_PERIOD;
            }
            future = taskScheduler.scheduleAtFixedRate(this::renew, clock.instant().plus(period), period);
        }

        void renew() {
            if (lost) {
                return;
            }
            try {
                Optional<ClipLease> renewed = store.renew(current, props.getLeaseTtl(), clock.instant());
                if (renewed.isPresent()) {
                    current = renewed.get();
                } else {
                    lost = true;
                    LOGGER.warn("LEASE lost clipId={} lease={}", current.clipId(), current.leaseId());
                    stop();
                }
            } catch (RuntimeException e) {
                LOGGER.warn("LEASE renew failed clipId={} err={}", current.clipId(), e.toString());
            }
        }

        boolean isLost() {
            return lost;
        }

        ClipLease current() {
            return current;
        }

        void stop() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
