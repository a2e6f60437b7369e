package com.phillippitts.voicecapture.service.audio.quality;

import com.phillippitts.voicecapture.domain.RecordingConstraints;

import java.time.Clock;
import java.util.Objects;

/**
 * Hysteresis state machine over per-buffer silence flags.
 *
 * <p>Silence is entered on the N-th consecutive silent buffer, where
 * N = silenceDurationMs / bufferDurationMs, and left after
 * {@value #BUFFERS_TO_EXIT_SILENCE} consecutive non-silent buffers. A single noisy
 * buffer therefore never breaks a silent period.
 *
 * <p>Not thread-safe. Each capture session owns one instance, driven by the capture thread.
 */
public class SilenceDetector {

    static final int BUFFERS_TO_EXIT_SILENCE = 2;

    private final Clock clock;
    private final long bufferDurationMs;
    private final long silenceDurationMs;
    private final int buffersForSilence;

    private int consecutiveSilent;
    private int consecutiveNonSilent;
    private boolean inSilence;
    private long silenceStartMillis;

    public SilenceDetector(RecordingConstraints constraints) {
        this(constraints, Clock.systemUTC());
    }

    public SilenceDetector(RecordingConstraints constraints, Clock clock) {
        Objects.requireNonNull(constraints, "constraints must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.bufferDurationMs = constraints.bufferDurationMs();
        this.silenceDurationMs = constraints.silenceDurationMs();
        this.buffersForSilence = (int) Math.max(1, silenceDurationMs / bufferDurationMs);
    }

    /**
     * Feeds the silence flag of the next buffer.
     *
     * @param silent whether the buffer was classified as silent
     * @return the resulting state
     */
    public SilenceState processSample(boolean silent) {
        if (silent) {
            consecutiveSilent++;
            consecutiveNonSilent = 0;
            if (!inSilence && consecutiveSilent >= buffersForSilence) {
                inSilence = true;
                silenceStartMillis = clock.millis() - consecutiveSilent * bufferDurationMs;
                return SilenceState.ENTERED_SILENCE;
            }
            return inSilence ? SilenceState.IN_SILENCE : SilenceState.NOT_SILENT;
        }

        consecutiveNonSilent++;
        consecutiveSilent = 0;
        if (inSilence) {
            if (consecutiveNonSilent >= BUFFERS_TO_EXIT_SILENCE) {
                inSilence = false;
                silenceStartMillis = 0L;
                return SilenceState.EXITED_SILENCE;
            }
            return SilenceState.IN_SILENCE;
        }
        return SilenceState.NOT_SILENT;
    }

    public boolean isInSilence() {
        return inSilence;
    }

    /** Milliseconds since the current silent period began; 0 when not silent. */
    public long currentSilenceDuration() {
        return inSilence ? clock.millis() - silenceStartMillis : 0L;
    }

    /** True when silence has lasted more than twice the configured silence duration. */
    public boolean shouldTrimSilence() {
        return inSilence && currentSilenceDuration() > 2 * silenceDurationMs;
    }

    public int buffersForSilence() {
        return buffersForSilence;
    }

    public void reset() {
        consecutiveSilent = 0;
        consecutiveNonSilent = 0;
        inSilence = false;
        silenceStartMillis = 0L;
    }
}
