package com.example.homemic_backend.model;

import com.example.homemic_backend.util.KeywordPriority;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "keyword")
public class Keyword {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "phrase", nullable = false)
    private String phrase;

    @Column(name = "category", length = 64)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private KeywordPriority priority = KeywordPriority.MEDIUM;

    @Column(name = "case_sensitive", nullable = false)
    private boolean caseSensitive;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "detection_count", nullable = false)
    private long detectionCount;

    @Column(name = "last_detected")
    private Instant lastDetected;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Keyword() {}

    public Keyword(String phrase, String category, KeywordPriority priority, boolean caseSensitive) {
        this.phrase = phrase;
        this.category = category;
        this.priority = priority == null ? KeywordPriority.MEDIUM : priority;
        this.caseSensitive = caseSensitive;
    }

    public UUID getId() { return id; }
    public String getPhrase() { return phrase; }
    public String getCategory() { return category; }
    public KeywordPriority getPriority() { return priority; }
    public boolean isCaseSensitive() { return caseSensitive; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public long getDetectionCount() { return detectionCount; }
    public Instant getLastDetected() { return lastDetected; }
    public Instant getCreatedAt() { return createdAt; }
}
