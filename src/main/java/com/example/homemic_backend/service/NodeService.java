package com.example.homemic_backend.service;

import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.repository.NodeRepository;
import com.example.homemic_backend.service.events.AudioLevelEvent;
import com.example.homemic_backend.service.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;

@Service
public class NodeService {
    private static final Logger LOGGER = LoggerFactory.getLogger(NodeService.class);
    public static final Pattern NODE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final NodeRepository nodeRepo;
    private final NodeHealthMonitor health;
    private final EventBus events;
    private final Clock clock;

    public NodeService(NodeRepository nodeRepo, NodeHealthMonitor health, EventBus events, Clock clock) {
        this.nodeRepo = nodeRepo;
        this.health = health;
        this.events = events;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Node> list(boolean includeDisabled) {
        return includeDisabled ? nodeRepo.findAll() : nodeRepo.findByEnabledTrueOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Node get(String id) {
        return nodeRepo.findById(id).orElseThrow(() -> new NotFoundException("Node", id));
    }

    @Transactional
    public Node register(String id, String name, String location) {
        requireValidId(id);
        Node node = nodeRepo.findById(id).orElseGet(() -> Node.register(id));
        if (name != null && !name.isBlank()) node.setName(name.trim());
        if (location != null && !location.isBlank()) node.setLocation(location.trim());
        node.setEnabled(true);
        LOGGER.info("NODE upsert id={} name={} location={}", id, node.getName(), node.getLocation());
        return nodeRepo.save(node);
    }

    @Transactional
    public Node update(String id, String name, String location, Boolean audioFiltering) {
        Node node = get(id);
        if (name != null && !name.isBlank()) node.setName(name.trim());
        if (location != null && !location.isBlank()) node.setLocation(location.trim());
        if (audioFiltering != null) node.setAudioFiltering(audioFiltering);
        return nodeRepo.save(node);
    }

    /** Soft delete: clips keep pointing at the node. */
    @Transactional
    public Node disable(String id) {
        Node node = get(id);
        node.setEnabled(false);
        LOGGER.info("NODE disabled id={}", id);
        return nodeRepo.save(node);
    }

    public Node heartbeat(String id, Double latencyMs, String ipAddress) {
        requireValidId(id);
        return health.recordContact(id, latencyMs, ipAddress);
    }

    public void audioLevel(String id, double level, double peak) {
        requireValidId(id);
        events.publish(new AudioLevelEvent(id, clamp01(level), clamp01(peak), clock.instant()));
    }

    public static void requireValidId(String id) {
        if (id == null || !NODE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("node id must match " + NODE_ID.pattern());
        }
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(1, v));
    }
}
