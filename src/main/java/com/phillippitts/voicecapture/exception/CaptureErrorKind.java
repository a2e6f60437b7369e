package com.phillippitts.voicecapture.exception;

/**
 * Classification of capture failures. Each kind carries the user-facing message
 * shown when the recording ends in an error state.
 */
public enum CaptureErrorKind {

    PERMISSION_DENIED("Audio recording permission denied"),
    DEVICE_UNAVAILABLE("Audio recording device unavailable"),
    CONFIGURATION_ERROR("Audio configuration error"),
    IO_ERROR("Audio I/O error"),
    SIZE_LIMIT_REACHED("Recording size limit reached"),
    UNKNOWN("Unknown recording error");

    private final String defaultMessage;

    CaptureErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
