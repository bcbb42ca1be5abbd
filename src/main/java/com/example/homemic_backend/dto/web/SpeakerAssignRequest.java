package com.example.homemic_backend.dto.web;

import java.util.UUID;

/** {@code speakerId == null} clears the attribution. */
public record SpeakerAssignRequest(UUID speakerId) {}
