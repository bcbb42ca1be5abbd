package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.util.ClipStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Clip rows plus the compare-and-swap updates that drive the processing state machine.
 * Every state-changing update checks the expected status (and lease where relevant) in its
 * WHERE clause; a return value of 0 means another worker got there first.
 */
public interface ClipRepository extends JpaRepository<Clip, UUID> {

    @Query("""
        select c.id from Clip c
        where c.status = :status
          and (c.nextAttemptAt is null or c.nextAttemptAt <= :now)
        order by c.recordedAt asc
        """)
    List<UUID> findReadyIds(@Param("status") ClipStatus status, @Param("now") Instant now, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Clip c
           set c.status = :processing,
               c.leaseId = :leaseId,
               c.leaseExpiresAt = :expiresAt,
               c.attempts = c.attempts + 1,
               c.version = c.version + 1
         where c.id = :id
           and c.status = :pending
           and (c.nextAttemptAt is null or c.nextAttemptAt <= :now)
        """)
    int claim(@Param("id") UUID id,
              @Param("leaseId") UUID leaseId,
              @Param("expiresAt") Instant expiresAt,
              @Param("now") Instant now,
              @Param("pending") ClipStatus pending,
              @Param("processing") ClipStatus processing);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Clip c
           set c.leaseExpiresAt = :expiresAt,
               c.version = c.version + 1
         where c.id = :id
           and c.leaseId = :leaseId
           and c.status = :processing
           and c.leaseExpiresAt >= :now
        """)
    int renew(@Param("id") UUID id,
              @Param("leaseId") UUID leaseId,
              @Param("expiresAt") Instant expiresAt,
              @Param("now") Instant now,
              @Param("processing") ClipStatus processing);

    @Query("""
        select c.id from Clip c
        where c.status = :processing and c.leaseExpiresAt < :now
        """)
    List<UUID> findExpiredLeaseIds(@Param("processing") ClipStatus processing, @Param("now") Instant now);

    // Attempts are left alone: the abandoned claim already counted.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Clip c
           set c.status = :pending,
               c.leaseId = null,
               c.leaseExpiresAt = null,
               c.version = c.version + 1
         where c.status = :processing
           and c.leaseExpiresAt < :now
        """)
    int releaseExpired(@Param("now") Instant now,
                       @Param("processing") ClipStatus processing,
                       @Param("pending") ClipStatus pending);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Clip c
           set c.status = :transcribed,
               c.transcriptText = :text,
               c.wordCount = :wordCount,
               c.processedAt = :now,
               c.processingDurationMs = :durationMs,
               c.errorMessage = null,
               c.nextAttemptAt = null,
               c.leaseId = null,
               c.leaseExpiresAt = null,
               c.version = c.version + 1
         where c.id = :id
           and c.leaseId = :leaseId
           and c.status = :processing
           and c.leaseExpiresAt >= :now
        """)
    int complete(@Param("id") UUID id,
                 @Param("leaseId") UUID leaseId,
                 @Param("text") String text,
                 @Param("wordCount") int wordCount,
                 @Param("durationMs") long durationMs,
                 @Param("now") Instant now,
                 @Param("processing") ClipStatus processing,
                 @Param("transcribed") ClipStatus transcribed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Clip c
           set c.status = :target,
               c.errorMessage = :message,
               c.nextAttemptAt = :nextAttemptAt,
               c.processedAt = :processedAt,
               c.leaseId = null,
               c.leaseExpiresAt = null,
               c.version = c.version + 1
         where c.id = :id
           and c.leaseId = :leaseId
           and c.status = :processing
        """)
    int fail(@Param("id") UUID id,
             @Param("leaseId") UUID leaseId,
             @Param("message") String message,
             @Param("nextAttemptAt") Instant nextAttemptAt,
             @Param("processedAt") Instant processedAt,
             @Param("processing") ClipStatus processing,
             @Param("target") ClipStatus target);

    @Query("""
        select c from Clip c
        where (:nodeId is null or c.node.id = :nodeId)
          and (:status is null or c.status = :status)
          and (:from is null or c.recordedAt >= :from)
          and (:to is null or c.recordedAt <= :to)
          and (:text is null or lower(c.transcriptText) like :text escape '!')
        """)
    Page<Clip> search(@Param("nodeId") String nodeId,
                      @Param("status") ClipStatus status,
                      @Param("from") Instant from,
                      @Param("to") Instant to,
                      @Param("text") String textPattern,
                      Pageable pageable);

    List<Clip> findByStatusOrderByProcessedAtDesc(ClipStatus status, Pageable pageable);

    List<Clip> findByStatusAndProcessedAtGreaterThanEqualOrderByProcessedAtDesc(ClipStatus status,
                                                                                 Instant since,
                                                                                 Pageable pageable);

    long countByStatus(ClipStatus status);

    @Query("""
        select avg(c.processingDurationMs) from Clip c
        where c.status = :status and c.processedAt >= :since
        """)
    Double averageProcessingMs(@Param("status") ClipStatus status, @Param("since") Instant since);

    /** Per-node totals for one status. */
    interface NodeActivity {
        String getNodeId();
        long getClipCount();
        double getTotalSeconds();
    }

    @Query("""
        select c.node.id as nodeId, count(c) as clipCount, coalesce(sum(c.durationSeconds), 0) as totalSeconds
        from Clip c
        where c.status = :status and c.recordedAt >= :since
        group by c.node.id
        """)
    List<NodeActivity> activityByNode(@Param("status") ClipStatus status, @Param("since") Instant since);

    @Query("select c.recordedAt from Clip c where c.status = :status and c.recordedAt >= :since")
    List<Instant> recordedTimes(@Param("status") ClipStatus status, @Param("since") Instant since);

    @Query("""
        select c from Clip c
        where c.audioDeleted = false
          and c.objectKey is not null
          and c.recordedAt < :cutoff
        order by c.recordedAt asc
        """)
    List<Clip> findAudioOlderThan(@Param("cutoff") Instant cutoff, Pageable pageable);
}
