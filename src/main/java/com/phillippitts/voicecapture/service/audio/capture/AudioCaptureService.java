package com.phillippitts.voicecapture.service.audio.capture;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.exception.CaptureException;
import com.phillippitts.voicecapture.service.audio.quality.AudioMetrics;
import com.phillippitts.voicecapture.service.audio.quality.QualityReport;
import com.phillippitts.voicecapture.service.audio.quality.RecordingStatistics;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Microphone capture service.
 *
 * Contract:
 * - One active session at a time; the service never holds more than one open input line
 * - Captured audio is conditioned and written as a 16 kHz, 16-bit, mono WAV file
 * - Capture stops by itself before the encoded file would exceed the upload limit
 */
public interface AudioCaptureService {

    /**
     * Opens the input line and starts a capture session.
     *
     * @param sessionId  identifier carried by logs and the resulting {@link AudioFile}
     * @param outputPath where the WAV file is written when the session stops
     * @param listener   receives asynchronous failures and the size-limit signal
     * @throws CaptureException if a session is already active or the line cannot be opened
     */
    void start(String sessionId, Path outputPath, CaptureListener listener);

    /**
     * Starts a capture session under a generated id.
     *
     * @return the new session id
     */
    default String start(Path outputPath, CaptureListener listener) {
        String sessionId = UUID.randomUUID().toString();
        start(sessionId, outputPath, listener);
        return sessionId;
    }

    /**
     * Stops the active session, waits for the capture thread and returns the finalized file.
     * Returns empty when idle or when no audio could be finalized.
     */
    Optional<AudioFile> stop();

    /** Stops the active session and deletes its output. No-op when idle. */
    void cancel();

    /** Suspends reading from the line without ending the session. */
    void pause();

    /** Resumes a paused session. */
    void resume();

    /** True while a session is reading or paused. */
    boolean isCapturing();

    CaptureState state();

    /** Metrics of the most recent buffer, or empty metrics when idle. */
    AudioMetrics currentMetrics();

    /** Running statistics of the active session, or empty statistics when idle. */
    RecordingStatistics currentStatistics();

    /** Quality report of the most recently finalized recording. */
    Optional<QualityReport> lastQualityReport();
}
