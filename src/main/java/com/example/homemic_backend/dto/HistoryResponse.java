package com.example.homemic_backend.dto;

import java.util.List;

public record HistoryResponse(long total, long offset, int limit, List<ClipSummary> clips) {
}
