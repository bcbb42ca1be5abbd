package com.example.homemic_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "speaker")
public class Speaker {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "color", nullable = false, length = 64)
    private String color = "bg-blue-500";

    // Opaque handle into the voice-embedding store; never interpreted here.
    @Column(name = "embedding_ref", length = 512)
    private String embeddingRef;

    @Column(name = "sample_count", nullable = false)
    private int sampleCount;

    @CreationTimestamp
    @Column(name = "enrolled_at", nullable = false, updatable = false)
    private Instant enrolledAt;

    protected Speaker() {}

    public Speaker(String name, String color) {
        this.name = name;
        if (color != null && !color.isBlank()) {
            this.color = color;
        }
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }
    public String getEmbeddingRef() { return embeddingRef; }
    public void setEmbeddingRef(String embeddingRef) { this.embeddingRef = embeddingRef; }
    public int getSampleCount() { return sampleCount; }
    public void setSampleCount(int sampleCount) { this.sampleCount = sampleCount; }
    public Instant getEnrolledAt() { return enrolledAt; }
}
