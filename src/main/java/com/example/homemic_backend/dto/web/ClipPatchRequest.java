package com.example.homemic_backend.dto.web;

import jakarta.validation.constraints.Size;

/**
 * User-editable clip metadata. Pipeline fields sent alongside are ignored.
 */
public record ClipPatchRequest(
        @Size(max = 255) String displayName,
        @Size(max = 4000) String notes
) {}
