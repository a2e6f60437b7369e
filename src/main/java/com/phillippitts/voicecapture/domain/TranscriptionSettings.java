package com.phillippitts.voicecapture.domain;

import java.util.Objects;

/**
 * Snapshot of user transcription preferences, taken once when a recording enters processing.
 *
 * @param language     ISO-639-1 language hint sent with the request
 * @param model        transcription model name
 * @param customPrompt optional prompt biasing the transcription; may be empty
 * @param temperature  sampling temperature in [0.0, 1.0]
 */
public record TranscriptionSettings(String language, String model, String customPrompt, double temperature) {

    public static final String DEFAULT_MODEL = "whisper-1";

    public TranscriptionSettings {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(model, "model must not be null");
        customPrompt = customPrompt == null ? "" : customPrompt;
        if (temperature < 0.0 || temperature > 1.0) {
            throw new IllegalArgumentException("temperature must be in [0.0, 1.0], got: " + temperature);
        }
    }

    public boolean hasCustomPrompt() {
        return !customPrompt.isBlank();
    }
}
