package com.example.homemic_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UuidGenerator;

import java.util.UUID;

@Entity
@Table(
        name = "transcript_segment",
        indexes = {
                @Index(name = "idx_segment_clip_start", columnList = "clip_id, start_time")
        }
)
@Check(constraints = "end_time >= start_time AND start_time >= 0")
public class TranscriptSegment {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "clip_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_segment_clip"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Clip clip;

    @Column(name = "start_time", nullable = false)
    private double startTime;

    @Column(name = "end_time", nullable = false)
    private double endTime;

    @Column(name = "text", nullable = false, columnDefinition = "text")
    private String text;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "speaker_id", foreignKey = @ForeignKey(name = "fk_segment_speaker"))
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Speaker speaker;

    protected TranscriptSegment() {}

    public TranscriptSegment(Clip clip, double startTime, double endTime, String text, double confidence) {
        this.clip = clip;
        this.startTime = startTime;
        this.endTime = endTime;
        this.text = text;
        this.confidence = confidence;
    }

    public UUID getId() { return id; }
    public Clip getClip() { return clip; }
    public double getStartTime() { return startTime; }
    public double getEndTime() { return endTime; }
    public String getText() { return text; }
    public double getConfidence() { return confidence; }
    public Speaker getSpeaker() { return speaker; }
    public void setSpeaker(Speaker speaker) { this.speaker = speaker; }
}
