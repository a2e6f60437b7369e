package com.phillippitts.voicecapture.exception;

/**
 * Thrown when a recording exceeds the maximum duration the transcription service accepts.
 * This is the only recording failure that cannot be retried.
 */
public class RecordingTimeoutException extends VoiceCaptureException {

    private final long limitMs;

    public RecordingTimeoutException(long limitMs) {
        super("Recording timeout after " + limitMs + " ms");
        this.limitMs = limitMs;
    }

    public long getLimitMs() {
        return limitMs;
    }
}
