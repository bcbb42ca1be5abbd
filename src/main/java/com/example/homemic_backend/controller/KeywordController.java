package com.example.homemic_backend.controller;

import com.example.homemic_backend.dto.KeywordDetectionResponse;
import com.example.homemic_backend.dto.KeywordResponse;
import com.example.homemic_backend.dto.web.KeywordRequest;
import com.example.homemic_backend.service.KeywordService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/keywords")
public class KeywordController {
    private final KeywordService keywordService;

    public KeywordController(KeywordService keywordService) {
        this.keywordService = keywordService;
    }

    @GetMapping
    public List<KeywordResponse> list() {
        return keywordService.list().stream().map(KeywordResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<KeywordResponse> create(@Valid @RequestBody KeywordRequest body) {
        var keyword = keywordService.create(body.phrase(), body.category(), body.priority(), body.caseSensitive());
        return ResponseEntity.status(HttpStatus.CREATED).body(KeywordResponse.from(keyword));
    }

    @PutMapping("/{id}/enabled")
    public KeywordResponse setEnabled(@PathVariable UUID id, @RequestParam("enabled") boolean enabled) {
        return KeywordResponse.from(keywordService.setEnabled(id, enabled));
    }

    @PostMapping("/{id}/reset")
    public KeywordResponse reset(@PathVariable UUID id) {
        return KeywordResponse.from(keywordService.reset(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        keywordService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/detections")
    public List<KeywordDetectionResponse> detections(@PathVariable UUID id,
                                                     @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return keywordService.detections(id, limit).stream().map(KeywordDetectionResponse::from).toList();
    }
}
