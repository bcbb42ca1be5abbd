package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.Keyword;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface KeywordRepository extends JpaRepository<Keyword, UUID> {

    List<Keyword> findByEnabledTrue();

    List<Keyword> findAllByOrderByCreatedAtDesc();

    // Atomic so concurrent workers never lose an increment; a keyword disabled meanwhile is skipped.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Keyword k
           set k.detectionCount = k.detectionCount + 1,
               k.lastDetected = :at
         where k.id = :id
           and k.enabled = true
        """)
    int recordDetection(@Param("id") UUID id, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Keyword k set k.detectionCount = 0, k.lastDetected = null where k.id = :id")
    int resetCount(@Param("id") UUID id);
}
