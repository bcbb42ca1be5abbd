package com.example.homemic_backend.dto.web;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record BulkClipsRequest(
        @NotEmpty @Size(max = 500) List<UUID> clipIds,
        String format
) {}
