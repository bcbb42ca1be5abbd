package com.example.homemic_backend.repository;

import com.example.homemic_backend.model.Speaker;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpeakerRepository extends JpaRepository<Speaker, UUID> {
    List<Speaker> findAllByOrderByNameAsc();
}
