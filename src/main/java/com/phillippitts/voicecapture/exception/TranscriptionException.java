package com.phillippitts.voicecapture.exception;

/**
 * Thrown when the transcription service rejects or fails to process a recording.
 * This may occur due to network errors, service-side errors or an unconfigured client.
 */
public class TranscriptionException extends VoiceCaptureException {

    private final String model;

    public TranscriptionException(String message) {
        super(message);
        this.model = "unknown";
    }

    public TranscriptionException(String message, String model) {
        super(message + " (model: " + model + ")");
        this.model = model;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.model = "unknown";
    }

    public TranscriptionException(String message, String model, Throwable cause) {
        super(message + " (model: " + model + ")", cause);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
