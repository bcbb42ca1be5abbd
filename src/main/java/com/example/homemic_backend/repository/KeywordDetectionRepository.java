package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.KeywordDetection;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface KeywordDetectionRepository extends JpaRepository<KeywordDetection, UUID> {

    List<KeywordDetection> findByKeywordIdOrderByDetectedAtDesc(UUID keywordId, Pageable pageable);

    boolean existsByKeywordIdAndClipId(UUID keywordId, UUID clipId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from KeywordDetection d where d.clip.id = :clipId")
    int deleteByClipId(@Param("clipId") UUID clipId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from KeywordDetection d where d.keyword.id = :keywordId")
    int deleteByKeywordId(@Param("keywordId") UUID keywordId);
}
