package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.PrivacySettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PrivacySettingsRepository extends JpaRepository<PrivacySettings, Long> {
}
