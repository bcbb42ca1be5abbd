package com.example.homemic_backend.controller;

import com.example.homemic_backend.dto.NodeResponse;
import com.example.homemic_backend.dto.web.AudioLevelRequest;
import com.example.homemic_backend.dto.web.NodeRequest;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.service.NodeHealthMonitor;
import com.example.homemic_backend.service.NodeService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/nodes")
public class NodeController {
    private final NodeService nodeService;
    private final NodeHealthMonitor health;

    public NodeController(NodeService nodeService, NodeHealthMonitor health) {
        this.nodeService = nodeService;
        this.health = health;
    }

    @GetMapping
    public List<NodeResponse> list(@RequestParam(value = "include_disabled", defaultValue = "false") boolean includeDisabled) {
        return nodeService.list(includeDisabled).stream().map(this::toResponse).toList();
    }

    @GetMapping("/{id}")
    public NodeResponse get(@PathVariable String id) {
        return toResponse(nodeService.get(id));
    }

    @PostMapping
    public ResponseEntity<NodeResponse> register(@Valid @RequestBody NodeRequest body) {
        Node node = nodeService.register(body.id(), body.name(), body.location());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(node));
    }

    @PutMapping("/{id}")
    public NodeResponse update(@PathVariable String id, @Valid @RequestBody NodeRequest body) {
        return toResponse(nodeService.update(id, body.name(), body.location(), body.audioFiltering()));
    }

    /** Soft delete: clips keep pointing at the node. */
    @DeleteMapping("/{id}")
    public NodeResponse disable(@PathVariable String id) {
        return toResponse(nodeService.disable(id));
    }

    @PostMapping("/{id}/heartbeat")
    public NodeResponse heartbeat(@PathVariable String id,
                                  @RequestParam(value = "latency", required = false) Double latencyMs,
                                  HttpServletRequest request) {
        return toResponse(nodeService.heartbeat(id, latencyMs, request.getRemoteAddr()));
    }

    @PostMapping("/{id}/audio-level")
    public ResponseEntity<Void> audioLevel(@PathVariable String id, @RequestBody AudioLevelRequest body) {
        nodeService.audioLevel(id, body.level(), body.peak());
        return ResponseEntity.accepted().build();
    }

    private NodeResponse toResponse(Node node) {
        return NodeResponse.from(node, health.currentStatus(node));
    }
}
