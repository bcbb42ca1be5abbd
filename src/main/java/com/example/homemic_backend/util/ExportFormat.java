package com.example.homemic_backend.util;

import org.springframework.http.MediaType;

import java.util.Locale;

public enum ExportFormat {
    TXT("txt", MediaType.TEXT_PLAIN),
    SRT("srt", MediaType.parseMediaType("application/x-subrip")),
    JSON("json", MediaType.APPLICATION_JSON);

    private final String extension;
    private final MediaType mediaType;

    ExportFormat(String extension, MediaType mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String extension() {
        return extension;
    }

    public MediaType mediaType() {
        return mediaType;
    }

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return TXT;
        }
        return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
