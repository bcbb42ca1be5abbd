package com.example.homemic_backend.model;

import com.example.homemic_backend.util.ClipStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
        name = "clip",
        indexes = {
                @Index(name = "idx_clip_node_status_recorded", columnList = "node_id, status, recorded_at"),
                @Index(name = "idx_clip_status_next_attempt", columnList = "status, next_attempt_at")
        }
)
public class Clip {
    public static final String PRIVACY_SUPPRESSED_MESSAGE = "suppressed: privacy rule";

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "node_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_clip_node"))
    private Node node;

    @Column(name = "filename", nullable = false)
    private String filename;

    @Column(name = "object_key", length = 1024)
    private String objectKey;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "duration_seconds", nullable = false)
    private double durationSeconds;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ClipStatus status = ClipStatus.PENDING;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    @Column(name = "transcript_text", columnDefinition = "text")
    private String transcriptText;

    @Column(name = "word_count", nullable = false)
    private int wordCount;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "notes", length = 4000)
    private String notes;

    @Column(name = "privacy_suppressed", nullable = false)
    private boolean privacySuppressed;

    @Column(name = "audio_deleted", nullable = false)
    private boolean audioDeleted;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "lease_id")
    private UUID leaseId;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @OneToMany(mappedBy = "clip", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("startTime ASC")
    private List<TranscriptSegment> segments = new ArrayList<>();

    @Version
    @Column(name = "version")
    private Long version;

    protected Clip() {}

    public Clip(UUID id, Node node, String filename, String objectKey, long fileSize,
                double durationSeconds, Instant recordedAt, Instant uploadedAt) {
        this.id = id;
        this.node = node;
        this.filename = filename;
        this.objectKey = objectKey;
        this.fileSize = fileSize;
        this.durationSeconds = durationSeconds;
        this.recordedAt = recordedAt;
        this.uploadedAt = uploadedAt;
    }

    /**
     * Marks a freshly built clip as stored for audit only. It is never queued.
     */
    public void suppress() {
        this.status = ClipStatus.FAILED;
        this.privacySuppressed = true;
        this.errorMessage = PRIVACY_SUPPRESSED_MESSAGE;
    }

    public boolean isLeaseActive(Instant now) {
        return status == ClipStatus.PROCESSING && leaseExpiresAt != null && !leaseExpiresAt.isBefore(now);
    }

    public UUID getId() { return id; }
    public Node getNode() { return node; }
    public String getNodeId() { return node == null ? null : node.getId(); }
    public String getFilename() { return filename; }
    public String getObjectKey() { return objectKey; }
    public void setObjectKey(String objectKey) { this.objectKey = objectKey; }
    public long getFileSize() { return fileSize; }
    public double getDurationSeconds() { return durationSeconds; }
    public Instant getRecordedAt() { return recordedAt; }
    public Instant getUploadedAt() { return uploadedAt; }
    public Instant getProcessedAt() { return processedAt; }
    public ClipStatus getStatus() { return status; }
    public void setStatus(ClipStatus status) { this.status = status; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Long getProcessingDurationMs() { return processingDurationMs; }
    public String getTranscriptText() { return transcriptText; }
    public int getWordCount() { return wordCount; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public boolean isPrivacySuppressed() { return privacySuppressed; }
    public boolean isAudioDeleted() { return audioDeleted; }
    public void setAudioDeleted(boolean audioDeleted) { this.audioDeleted = audioDeleted; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public void setNextAttemptAt(Instant nextAttemptAt) { this.nextAttemptAt = nextAttemptAt; }
    public UUID getLeaseId() { return leaseId; }
    public Instant getLeaseExpiresAt() { return leaseExpiresAt; }
    public List<TranscriptSegment> getSegments() { return segments; }
    public Long getVersion() { return version; }
}
