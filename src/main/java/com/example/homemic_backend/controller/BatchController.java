package com.example.homemic_backend.controller;

import com.example.homemic_backend.config.IngestProperties;
import com.example.homemic_backend.dto.BulkDeleteResponse;
import com.example.homemic_backend.dto.ClipDetailResponse;
import com.example.homemic_backend.dto.ClipSummary;
import com.example.homemic_backend.dto.HistoryResponse;
import com.example.homemic_backend.dto.SegmentResponse;
import com.example.homemic_backend.dto.UploadResponse;
import com.example.homemic_backend.dto.web.BulkClipsRequest;
import com.example.homemic_backend.dto.web.ClipPatchRequest;
import com.example.homemic_backend.dto.web.SpeakerAssignRequest;
import com.example.homemic_backend.exception.ClipTooLargeException;
import com.example.homemic_backend.exception.ClipValidationException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.service.ClipService;
import com.example.homemic_backend.service.IngestionService;
import com.example.homemic_backend.service.SpeakerService;
import com.example.homemic_backend.service.TranscriptExporter;
import com.example.homemic_backend.util.ClipStatus;
import com.example.homemic_backend.util.ExportFormat;
import com.example.homemic_backend.util.TimestampParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/batch")
public class BatchController {
    private static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private final IngestionService ingestionService;
    private final ClipService clipService;
    private final SpeakerService speakerService;
    private final IngestProperties ingestProperties;

    public BatchController(IngestionService ingestionService,
                           ClipService clipService,
                           SpeakerService speakerService,
                           IngestProperties ingestProperties) {
        this.ingestionService = ingestionService;
        this.clipService = clipService;
        this.speakerService = speakerService;
        this.ingestProperties = ingestProperties;
    }

    @Operation(summary = "Accept one recorded clip from a capture node")
    @ApiResponse(responseCode = "201", description = "Clip stored; queued, or suppressed by a privacy rule")
    @ApiResponse(responseCode = "400", description = "Invalid node id, empty audio or unusable duration")
    @ApiResponse(responseCode = "413", description = "Audio larger than the configured limit")
    @ApiResponse(responseCode = "503", description = "Audio or clip row could not be stored")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(
            @RequestPart("audio") MultipartFile audio,
            @RequestParam("node_id") String nodeId,
            @RequestParam(value = "recorded_at", required = false) String recordedAt,
            @RequestParam(value = "duration_seconds", required = false) Double durationSeconds,
            HttpServletRequest request) throws IOException {
        byte[] bytes;
        try (InputStream in = audio.getInputStream()) {
            bytes = readCapped(in);
        }
        return accept(nodeId, audio.getOriginalFilename(), bytes, recordedAt, durationSeconds, request);
    }

    /** Raw-body variant for agents that stream the WAV without multipart framing. */
    @PostMapping(value = "/upload", consumes = {"audio/wav", "audio/x-wav", MediaType.APPLICATION_OCTET_STREAM_VALUE})
    public ResponseEntity<UploadResponse> uploadRaw(
            InputStream body,
            @RequestParam("node_id") String nodeId,
            @RequestParam(value = "filename", required = false) String filename,
            @RequestParam(value = "recorded_at", required = false) String recordedAt,
            @RequestParam(value = "duration_seconds", required = false) Double durationSeconds,
            HttpServletRequest request) throws IOException {
        return accept(nodeId, filename, readCapped(body), recordedAt, durationSeconds, request);
    }

    @GetMapping("/history")
    public HistoryResponse history(
            @RequestParam(value = "node_id", required = false) String nodeId,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "limit", defaultValue = "" + ClipService.DEFAULT_LIMIT) int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return clipService.history(nodeId,
                ClipStatus.fromWire(status),
                TimestampParser.parse(startDate, "start_date"),
                TimestampParser.parse(endDate, "end_date"),
                search,
                offset,
                limit);
    }

    @GetMapping("/recent")
    public List<ClipSummary> recent(@RequestParam(value = "minutes", defaultValue = "5") int minutes) {
        return clipService.recent(minutes);
    }

    @GetMapping("/clips/{id}")
    public ClipDetailResponse get(@PathVariable UUID id) {
        return clipService.detail(id);
    }

    @GetMapping(value = "/clips/{id}/audio", produces = {"audio/wav", MediaType.APPLICATION_OCTET_STREAM_VALUE})
    public ResponseEntity<Resource> audio(@PathVariable UUID id) {
        Path path = clipService.audio(id);
        return ResponseEntity.ok()
                .contentType(AUDIO_WAV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.inline()
                        .filename(path.getFileName().toString(), StandardCharsets.UTF_8).build().toString())
                .body(new FileSystemResource(path));
    }

    @GetMapping("/clips/{id}/export")
    public ResponseEntity<String> export(@PathVariable UUID id,
                                         @RequestParam(value = "format", required = false) String format) {
        return asAttachment(clipService.export(id, ExportFormat.parse(format)));
    }

    /** Only display name and notes are writable; any other field in the body is ignored. */
    @PatchMapping("/clips/{id}")
    public ClipDetailResponse patch(@PathVariable UUID id, @Valid @RequestBody ClipPatchRequest body) {
        return clipService.updateMetadata(id, body.displayName(), body.notes());
    }

    @DeleteMapping("/clips/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id,
                                       @RequestParam(value = "delete_file", defaultValue = "true") boolean deleteFile) {
        clipService.delete(id, deleteFile);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/clips/{id}/retry")
    public ResponseEntity<ClipDetailResponse> retry(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(clipService.retry(id));
    }

    @PostMapping("/bulk/delete")
    public BulkDeleteResponse bulkDelete(@Valid @RequestBody BulkClipsRequest body) {
        return clipService.bulkDelete(body.clipIds());
    }

    @PostMapping("/bulk/export")
    public ResponseEntity<String> bulkExport(@Valid @RequestBody BulkClipsRequest body) {
        String format = body.format() == null || body.format().isBlank() ? "json" : body.format();
        return asAttachment(clipService.bulkExport(body.clipIds(), ExportFormat.parse(format)));
    }

    @PutMapping("/segments/{segmentId}/speaker")
    public SegmentResponse assignSpeaker(@PathVariable UUID segmentId, @RequestBody SpeakerAssignRequest body) {
        return SegmentResponse.from(speakerService.reassign(segmentId, body.speakerId()));
    }

    private ResponseEntity<UploadResponse> accept(String nodeId,
                                                  String filename,
                                                  byte[] bytes,
                                                  String recordedAt,
                                                  Double durationSeconds,
                                                  HttpServletRequest request) {
        Instant when = parseRecordedAt(recordedAt);
        Clip clip = ingestionService.upload(new IngestionService.ClipUpload(
                nodeId, filename, bytes, when, durationSeconds, request.getRemoteAddr()));
        return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.from(clip));
    }

    private static Instant parseRecordedAt(String recordedAt) {
        try {
            return TimestampParser.parse(recordedAt, "recorded_at");
        } catch (IllegalArgumentException e) {
            throw new ClipValidationException("recorded_at", e.getMessage());
        }
    }

    private byte[] readCapped(InputStream in) throws IOException {
        long max = ingestProperties.getMaxFileSize().toBytes();
        byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, max + 1));
        if (bytes.length > max) {
            throw new ClipTooLargeException(max);
        }
        return bytes;
    }

    private static ResponseEntity<String> asAttachment(TranscriptExporter.ExportDocument doc) {
        return ResponseEntity.ok()
                .contentType(doc.format().mediaType())
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(doc.filename(), StandardCharsets.UTF_8).build().toString())
                .body(doc.body());
    }
}
