package com.example.homemic_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "keyword_detection",
        indexes = {
                @Index(name = "idx_detection_keyword", columnList = "keyword_id, detected_at")
        }
)
public class KeywordDetection {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "keyword_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_detection_keyword"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Keyword keyword;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "clip_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_detection_clip"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Clip clip;

    @Column(name = "snippet", length = 512)
    private String snippet;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    protected KeywordDetection() {}

    public KeywordDetection(Keyword keyword, Clip clip, String snippet, Instant detectedAt) {
        this.keyword = keyword;
        this.clip = clip;
        this.snippet = snippet;
        this.detectedAt = detectedAt;
    }

    public UUID getId() { return id; }
    public Keyword getKeyword() { return keyword; }
    public Clip getClip() { return clip; }
    public String getSnippet() { return snippet; }
    public Instant getDetectedAt() { return detectedAt; }
}
