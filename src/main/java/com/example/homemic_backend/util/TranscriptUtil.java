package com.example.homemic_backend.util;

import java.util.List;
import java.util.regex.Pattern;

public final class TranscriptUtil {
    private TranscriptUtil(){}

    // Strings the recogniser emits on silence or noise.
    private static final List<String> ARTIFACTS = List.of(
            "[BLANK_AUDIO]",
            "(silence)",
            "[silence]",
            "(inaudible)",
            "[inaudible]",
            "[MUSIC]",
            "(music)",
            "Thank you.",
            "Thanks for watching!"
    );
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String out = text;
        for (String artifact : ARTIFACTS) {
            out = out.replace(artifact, "");
        }
        return WHITESPACE.matcher(out).replaceAll(" ").trim();
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.trim()).length;
    }

    public static String preview(String text, int maxChars) {
        if (text == null) {
            return null;
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
