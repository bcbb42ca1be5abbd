package com.example.homemic_backend.dto.web;

import jakarta.validation.constraints.Size;

public record NodeRequest(
        @Size(max = 64) String id,
        @Size(max = 255) String name,
        @Size(max = 255) String location,
        Boolean audioFiltering
) {}
