package com.example.homemic_backend.dto.web;

import com.example.homemic_backend.util.KeywordPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record KeywordRequest(
        @NotBlank @Size(max = 255) String phrase,
        @Size(max = 64) String category,
        KeywordPriority priority,
        boolean caseSensitive
) {}
