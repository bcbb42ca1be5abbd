package com.example.homemic_backend.dto;

import java.util.List;
import java.util.UUID;

public record BulkDeleteResponse(int deleted, List<UUID> clipIds, int filesRemoved) {
}
