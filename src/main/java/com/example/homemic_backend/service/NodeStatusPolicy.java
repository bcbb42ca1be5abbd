package com.example.homemic_backend.service;

import com.example.homemic_backend.config.HealthProperties;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.util.NodeStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Derives a node's status from its last contact and rolling latency.
 */
@Component
public class NodeStatusPolicy {

    private final HealthProperties props;

    public NodeStatusPolicy(HealthProperties props) {
        this.props = props;
    }

    public NodeStatus evaluate(Instant lastSeen, double latencyMs, Instant now) {
        if (lastSeen == null) {
            return NodeStatus.OFFLINE;
        }
        Duration age = Duration.between(lastSeen, now);
        if (age.compareTo(props.getFreshnessWindow()) > 0) {
            return NodeStatus.OFFLINE;
        }
        if (latencyMs > props.getLatencyWarningMs()) {
            return NodeStatus.WARNING;
        }
        return NodeStatus.ONLINE;
    }

    /** Disabled nodes read as offline whatever their last contact. */
    public NodeStatus evaluate(Node node, Instant now) {
        if (!node.isEnabled()) {
            return NodeStatus.OFFLINE;
        }
        return evaluate(node.getLastSeen(), node.getLatencyMs(), now);
    }
}
