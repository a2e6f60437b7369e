package com.phillippitts.voicecapture.exception;

/**
 * Base exception for all voice-capture application errors.
 * All domain exceptions extend this class so callers can handle them in one place.
 */
public class VoiceCaptureException extends RuntimeException {

    public VoiceCaptureException(String message) {
        super(message);
    }

    public VoiceCaptureException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceCaptureException(Throwable cause) {
        super(cause);
    }
}
