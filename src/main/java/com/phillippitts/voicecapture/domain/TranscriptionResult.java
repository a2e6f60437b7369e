package com.phillippitts.voicecapture.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result returned by the transcription service for one recording.
 *
 * @param text            the transcribed text (must not be null; empty is valid for silence)
 * @param language        language detected by the service, or {@code null} when not reported
 * @param durationSeconds audio duration reported by the service, or {@code null} when not reported
 */
public record TranscriptionResult(String text, String language, Double durationSeconds) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if text is null
     * @throws IllegalArgumentException if durationSeconds is negative
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (durationSeconds != null && durationSeconds < 0.0) {
            throw new IllegalArgumentException("Duration must be >= 0, got: " + durationSeconds);
        }
    }

    /**
     * Creates a result that carries only text.
     *
     * @param text the transcribed text
     * @return a new TranscriptionResult instance
     */
    public static TranscriptionResult of(String text) {
        return new TranscriptionResult(text, null, null);
    }

    public Optional<String> detectedLanguage() {
        return Optional.ofNullable(language);
    }

    public Optional<Double> reportedDuration() {
        return Optional.ofNullable(durationSeconds);
    }
}
