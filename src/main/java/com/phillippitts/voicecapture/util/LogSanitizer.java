package com.phillippitts.voicecapture.util;

/** Utility for privacy-safe logging of transcription text. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Single-line preview of transcribed text: line breaks and runs of whitespace collapse to
     * one space, and text longer than {@code max} characters is cut and marked with "...".
     * Returns "" for null or a non-positive limit.
     */
    public static String preview(String text, int max) {
        if (text == null || max <= 0) {
            return "";
        }
        String flat = text.strip().replaceAll("\\s+", " ");
        if (flat.length() <= max) {
            return flat;
        }
        return flat.substring(0, max) + ELLIPSIS;
    }
}
