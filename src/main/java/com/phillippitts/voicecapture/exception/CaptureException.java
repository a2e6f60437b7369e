package com.phillippitts.voicecapture.exception;

import java.util.Objects;

/**
 * Thrown when microphone capture cannot start or fails while running.
 *
 * <p>The {@link CaptureErrorKind} identifies the failure class. Capture failures are always
 * retryable from the resulting error state.
 */
public class CaptureException extends VoiceCaptureException {

    private final CaptureErrorKind kind;

    public CaptureException(CaptureErrorKind kind) {
        this(kind, kind.defaultMessage(), null);
    }

    public CaptureException(CaptureErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public CaptureException(CaptureErrorKind kind, String detail, Throwable cause) {
        super(buildMessage(kind, detail), cause);
        this.kind = kind;
    }

    public CaptureErrorKind getKind() {
        return kind;
    }

    private static String buildMessage(CaptureErrorKind kind, String detail) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (detail == null || detail.isBlank() || detail.equals(kind.defaultMessage())) {
            return kind.defaultMessage();
        }
        return kind.defaultMessage() + ": " + detail;
    }
}
