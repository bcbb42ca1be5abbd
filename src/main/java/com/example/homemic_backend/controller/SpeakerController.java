package com.example.homemic_backend.controller;

import com.example.homemic_backend.dto.SpeakerResponse;
import com.example.homemic_backend.dto.web.SpeakerRequest;
import com.example.homemic_backend.service.SpeakerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/speakers")
public class SpeakerController {
    private final SpeakerService speakerService;

    public SpeakerController(SpeakerService speakerService) {
        this.speakerService = speakerService;
    }

    @GetMapping
    public List<SpeakerResponse> list() {
        return speakerService.list().stream().map(SpeakerResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<SpeakerResponse> create(@Valid @RequestBody SpeakerRequest body) {
        var speaker = speakerService.create(body.name(), body.color());
        return ResponseEntity.status(HttpStatus.CREATED).body(SpeakerResponse.from(speaker));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        speakerService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
