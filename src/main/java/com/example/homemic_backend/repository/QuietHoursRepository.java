package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.QuietHours;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface QuietHoursRepository extends JpaRepository<QuietHours, UUID> {
    List<QuietHours> findByEnabledTrue();

    List<QuietHours> findAllByOrderByStartTimeAsc();
}
