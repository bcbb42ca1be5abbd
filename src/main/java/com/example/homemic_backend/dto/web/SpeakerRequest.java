package com.example.homemic_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record SpeakerRequest(@NotBlank String name, String color) {}
