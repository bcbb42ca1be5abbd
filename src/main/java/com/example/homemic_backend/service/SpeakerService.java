package com.example.homemic_backend.service;

import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.Speaker;
import com.example.homemic_backend.model.TranscriptSegment;
import com.example.homemic_backend.repository.SpeakerRepository;
import com.example.homemic_backend.repository.TranscriptSegmentRepository;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class SpeakerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerService.class);

    private final SpeakerRepository speakerRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final ClipStore clipStore;

    public SpeakerService(SpeakerRepository speakerRepo, TranscriptSegmentRepository segmentRepo, ClipStore clipStore) {
        this.speakerRepo = speakerRepo;
        this.segmentRepo = segmentRepo;
        this.clipStore = clipStore;
    }

    @Transactional(readOnly = true)
    public List<Speaker> list() {
        return speakerRepo.findAllByOrderByNameAsc();
    }

    @Transactional
    public Speaker create(String name, String color) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        return speakerRepo.save(new Speaker(name.trim(), color));
    }

    /** Segments that pointed at the speaker are kept and become unattributed. */
    @Transactional
    public void delete(UUID id) {
        if (!speakerRepo.existsById(id)) {
            throw new NotFoundException("Speaker", id);
        }
        int cleared = segmentRepo.clearSpeaker(id);
        speakerRepo.deleteById(id);
        LOGGER.info("Speaker deleted id={} segmentsUnlinked={}", id, cleared);
    }

    public TranscriptSegment reassign(UUID segmentId, UUID speakerId) {
        return clipStore.reassignSpeaker(segmentId, speakerId);
    }
}
