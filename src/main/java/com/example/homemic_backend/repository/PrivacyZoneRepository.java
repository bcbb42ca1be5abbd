package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.PrivacyZone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface PrivacyZoneRepository extends JpaRepository<PrivacyZone, UUID> {

    List<PrivacyZone> findByActiveTrue();

    List<PrivacyZone> findByNodeIdAndActiveTrue(String nodeId);

    List<PrivacyZone> findAllByOrderByStartTimeDesc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update PrivacyZone z set z.active = false
         where z.active = true and z.endTime is not null and z.endTime <= :now
        """)
    int deactivateExpired(@Param("now") Instant now);
}
