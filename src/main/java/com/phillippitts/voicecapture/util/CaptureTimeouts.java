package com.phillippitts.voicecapture.util;

import java.time.Duration;

/**
 * Standard timeout values for capture thread management.
 *
 * <p>Used by {@link com.phillippitts.voicecapture.service.audio.capture.JavaSoundAudioCaptureService}
 * for capture thread lifecycle management.
 *
 * @see com.phillippitts.voicecapture.service.audio.capture.JavaSoundAudioCaptureService
 * @since 1.0
 */
public final class CaptureTimeouts {

    /**
     * Timeout for the capture thread to finish during a normal stop.
     *
     * <p>Covers draining the last buffer plus signal processing and WAV encoding of a
     * recording up to the upload limit.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Timeout for the capture thread during cancel or forced shutdown (best-effort).
     *
     * <p>No encoding happens on these paths. The thread is a daemon and is terminated by
     * the JVM if it doesn't respond.
     */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Poll interval of the capture loop while paused. */
    public static final Duration PAUSE_POLL_INTERVAL = Duration.ofMillis(20);

    private CaptureTimeouts() {
        // Utility class - prevent instantiation
    }
}
