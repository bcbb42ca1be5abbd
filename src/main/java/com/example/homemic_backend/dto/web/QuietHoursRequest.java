package com.example.homemic_backend.dto.web;

import jakarta.validation.constraints.NotNull;

import java.time.LocalTime;

public record QuietHoursRequest(
        @NotNull LocalTime start,
        @NotNull LocalTime end,
        String label,
        Boolean enabled
) {}
