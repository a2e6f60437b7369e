package com.phillippitts.voicecapture.testutil;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.exception.CaptureException;
import com.phillippitts.voicecapture.service.audio.capture.AudioCaptureService;
import com.phillippitts.voicecapture.service.audio.capture.CaptureListener;
import com.phillippitts.voicecapture.service.audio.capture.CaptureState;
import com.phillippitts.voicecapture.service.audio.quality.AudioMetrics;
import com.phillippitts.voicecapture.service.audio.quality.QualityReport;
import com.phillippitts.voicecapture.service.audio.quality.RecordingStatistics;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for AudioCaptureService that records calls and returns a canned file.
 *
 * <p>By default {@link #stop()} returns a 1-second recording (32044 bytes) at the output path
 * given to {@link #start}. Tests can make start fail, make stop return nothing, and fire the
 * capture-thread callbacks through {@link #listener()}.
 *
 * <p><b>Public fields:</b> call counters are exposed to allow tests to verify interactions.
 */
public class FakeAudioCaptureService implements AudioCaptureService {
    public final AtomicInteger startCount = new AtomicInteger();
    public final AtomicInteger stopCount = new AtomicInteger();
    public final AtomicInteger cancelCount = new AtomicInteger();
    public final AtomicInteger pauseCount = new AtomicInteger();
    public final AtomicInteger resumeCount = new AtomicInteger();

    private volatile CaptureException startFailure;
    private volatile boolean produceFile = true;
    private volatile CaptureState state = CaptureState.IDLE;
    private volatile CaptureListener listener = CaptureListener.NONE;
    private volatile String sessionId;
    private volatile Path outputPath;

    /** Makes the next starts throw the given exception; {@code null} restores success. */
    public void failStartWith(CaptureException failure) {
        this.startFailure = failure;
    }

    /** Controls whether stop returns a file. */
    public void produceFile(boolean produceFile) {
        this.produceFile = produceFile;
    }

    public CaptureListener listener() {
        return listener;
    }

    public String sessionId() {
        return sessionId;
    }

    public Path outputPath() {
        return outputPath;
    }

    @Override
    public void start(String sessionId, Path outputPath, CaptureListener listener) {
        startCount.incrementAndGet();
        if (startFailure != null) {
            throw startFailure;
        }
        this.sessionId = sessionId;
        this.outputPath = outputPath;
        this.listener = listener;
        this.state = CaptureState.ACTIVE;
    }

    @Override
    public Optional<AudioFile> stop() {
        stopCount.incrementAndGet();
        boolean wasActive = state != CaptureState.IDLE;
        state = CaptureState.IDLE;
        if (!wasActive || !produceFile) {
            return Optional.empty();
        }
        return Optional.of(new AudioFile(outputPath, 1_000, 32_044, sessionId));
    }

    @Override
    public void cancel() {
        cancelCount.incrementAndGet();
        state = CaptureState.IDLE;
    }

    @Override
    public void pause() {
        pauseCount.incrementAndGet();
        if (state == CaptureState.ACTIVE) {
            state = CaptureState.PAUSED;
        }
    }

    @Override
    public void resume() {
        resumeCount.incrementAndGet();
        if (state == CaptureState.PAUSED) {
            state = CaptureState.ACTIVE;
        }
    }

    @Override
    public boolean isCapturing() {
        return state == CaptureState.ACTIVE || state == CaptureState.PAUSED;
    }

    @Override
    public CaptureState state() {
        return state;
    }

    @Override
    public AudioMetrics currentMetrics() {
        return AudioMetrics.empty(-50.0);
    }

    @Override
    public RecordingStatistics currentStatistics() {
        return RecordingStatistics.empty();
    }

    @Override
    public Optional<QualityReport> lastQualityReport() {
        return Optional.empty();
    }
}
