package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.TranscriptSegment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TranscriptSegmentRepository extends JpaRepository<TranscriptSegment, UUID> {

    @Query("""
        select s from TranscriptSegment s
        left join fetch s.speaker
        where s.clip.id = :clipId
        order by s.startTime asc
        """)
    List<TranscriptSegment> findForClip(@Param("clipId") UUID clipId);

    @Query("""
        select s from TranscriptSegment s
        left join fetch s.speaker
        where s.clip.id in :clipIds
        order by s.startTime asc
        """)
    List<TranscriptSegment> findForClips(@Param("clipIds") Collection<UUID> clipIds);

    @Query("""
        select s from TranscriptSegment s
        join fetch s.clip
        left join fetch s.speaker
        where s.id = :id
        """)
    Optional<TranscriptSegment> findWithClip(@Param("id") UUID id);

    long countByClipId(UUID clipId);

    /** Attributed speech per speaker. */
    interface SpeakerActivity {
        UUID getSpeakerId();
        long getSegmentCount();
        long getClipCount();
        double getTotalSeconds();
    }

    @Query("""
        select s.speaker.id as speakerId,
               count(s) as segmentCount,
               count(distinct s.clip.id) as clipCount,
               coalesce(sum(s.endTime - s.startTime), 0) as totalSeconds
        from TranscriptSegment s
        where s.speaker is not null and s.clip.recordedAt >= :since
        group by s.speaker.id
        """)
    List<SpeakerActivity> activityBySpeaker(@Param("since") Instant since);

    @Query("select count(s) from TranscriptSegment s where s.speaker is null and s.clip.recordedAt >= :since")
    long countUnattributedSince(@Param("since") Instant since);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from TranscriptSegment s where s.clip.id = :clipId")
    int deleteByClipId(@Param("clipId") UUID clipId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update TranscriptSegment s set s.speaker = null where s.speaker.id = :speakerId")
    int clearSpeaker(@Param("speakerId") UUID speakerId);
}
