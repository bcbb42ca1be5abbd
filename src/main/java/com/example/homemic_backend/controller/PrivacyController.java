package com.example.homemic_backend.controller;

import com.example.homemic_backend.dto.PrivacyZoneResponse;
import com.example.homemic_backend.dto.QuietHoursResponse;
import com.example.homemic_backend.dto.web.QuietHoursRequest;
import com.example.homemic_backend.service.PrivacyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/privacy")
public class PrivacyController {
    private final PrivacyService privacyService;

    public PrivacyController(PrivacyService privacyService) {
        this.privacyService = privacyService;
    }

    @Operation(summary = "Mute one node; clips recorded while muted are kept for audit but never transcribed")
    @ApiResponse(responseCode = "200", description = "Mute zone created")
    @ApiResponse(responseCode = "400", description = "Non-positive duration")
    @ApiResponse(responseCode = "404", description = "Unknown node")
    @PostMapping("/mute/{nodeId}")
    public PrivacyZoneResponse mute(@PathVariable String nodeId,
                                    @RequestParam(value = "duration_minutes", required = false) Integer durationMinutes,
                                    @RequestParam(value = "reason", required = false) String reason) {
        return PrivacyZoneResponse.from(privacyService.mute(nodeId, durationMinutes, reason));
    }

    @PostMapping("/unmute/{nodeId}")
    public Map<String, Object> unmute(@PathVariable String nodeId) {
        int deactivated = privacyService.unmute(nodeId);
        return Map.of("node_id", nodeId, "zones_deactivated", deactivated);
    }

    @PostMapping("/mute-all")
    public Map<String, Object> muteAll(@RequestParam(value = "reason", required = false) String reason) {
        var settings = privacyService.muteAll(reason);
        return Map.of("global_mute", settings.isGlobalMute(), "reason", settings.getGlobalMuteReason());
    }

    @PostMapping("/unmute-all")
    public Map<String, Object> unmuteAll() {
        int deactivated = privacyService.unmuteAll();
        return Map.of("global_mute", false, "zones_deactivated", deactivated);
    }

    @GetMapping("/status/{nodeId}")
    public PrivacyService.PrivacyStatus status(@PathVariable String nodeId) {
        return privacyService.status(nodeId);
    }

    @GetMapping("/zones")
    public List<PrivacyZoneResponse> zones(@RequestParam(value = "active_only", defaultValue = "true") boolean activeOnly) {
        return privacyService.zones(activeOnly).stream().map(PrivacyZoneResponse::from).toList();
    }

    @GetMapping("/quiet-hours")
    public List<QuietHoursResponse> quietHours() {
        return privacyService.quietHours().stream().map(QuietHoursResponse::from).toList();
    }

    @PostMapping("/quiet-hours")
    public ResponseEntity<QuietHoursResponse> addQuietHours(@Valid @RequestBody QuietHoursRequest body) {
        var window = privacyService.addQuietHours(body.start(), body.end(), body.label(),
                body.enabled() == null || body.enabled());
        return ResponseEntity.status(HttpStatus.CREATED).body(QuietHoursResponse.from(window));
    }

    @DeleteMapping("/quiet-hours/{id}")
    public ResponseEntity<Void> deleteQuietHours(@PathVariable UUID id) {
        privacyService.deleteQuietHours(id);
        return ResponseEntity.noContent().build();
    }
}
