package com.example.homemic_backend.service;

import com.example.homemic_backend.config.EventsProperties;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.repository.ClipRepository;
import com.example.homemic_backend.repository.NodeRepository;
import com.example.homemic_backend.repository.TranscriptSegmentRepository;
import com.example.homemic_backend.service.events.InitialStateEvent;
import com.example.homemic_backend.service.events.InitialStateProvider;
import com.example.homemic_backend.service.events.NodeStatusEvent;
import com.example.homemic_backend.service.events.TranscriptionEvent;
import com.example.homemic_backend.util.ClipStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Builds the {@code initial_state} frame: latest transcriptions plus every node's current status.
 */
@Service
public class DashboardSnapshotService implements InitialStateProvider {

    private final ClipRepository clipRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final NodeRepository nodeRepo;
    private final NodeStatusPolicy policy;
    private final EventsProperties props;
    private final Clock clock;

    public DashboardSnapshotService(ClipRepository clipRepo,
                                    TranscriptSegmentRepository segmentRepo,
                                    NodeRepository nodeRepo,
                                    NodeStatusPolicy policy,
                                    EventsProperties props,
                                    Clock clock) {
        this.clipRepo = clipRepo;
        this.segmentRepo = segmentRepo;
        this.nodeRepo = nodeRepo;
        this.policy = policy;
        this.props = props;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public InitialStateEvent snapshot() {
        Instant now = clock.instant();
        List<TranscriptionEvent> recent = clipRepo
                .findByStatusOrderByProcessedAtDesc(ClipStatus.TRANSCRIBED, PageRequest.of(0, Math.max(1, props.getInitialStateSize())))
                .stream()
                .map(this::toEvent)
                .toList();
        List<NodeStatusEvent> nodes = nodeRepo.findByEnabledTrueOrderByIdAsc().stream()
                .map(n -> toStatus(n, now))
                .toList();
        return new InitialStateEvent(recent, nodes, now);
    }

    private TranscriptionEvent toEvent(Clip clip) {
        return new TranscriptionEvent(clip.getId(), clip.getNodeId(), clip.getTranscriptText(), clip.getWordCount(),
                (int) segmentRepo.countByClipId(clip.getId()), clip.getDurationSeconds(), clip.getRecordedAt(),
                clip.getProcessedAt());
    }

    private NodeStatusEvent toStatus(Node node, Instant now) {
        return new NodeStatusEvent(node.getId(), node.getName(), node.getLocation(), policy.evaluate(node, now),
                null, node.getLastSeen(), node.getLatencyMs());
    }
}
