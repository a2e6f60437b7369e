package com.phillippitts.voicecapture.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Lifecycle state of the single foreground recording.
 *
 * <p>Transitions:
 * <pre>
 * Idle       → Recording   (start)
 * Recording  → Processing  (stop)
 * Recording  → Error       (timeout, capture failure, device loss)
 * Recording  → Idle        (cancel)
 * Processing → Success     (transcription succeeded)
 * Processing → Error       (transcription or encode failure)
 * Success    → Idle        (display timer elapsed, or explicit reset)
 * Error      → Idle        (retry, when retryable)
 * </pre>
 *
 * <p>Variants are value objects: two states are equal when their components are equal.
 * Guards in the orchestrator compare the current state against the state a transition
 * was scheduled for, so a stale timer never acts on a newer session.
 *
 * @since 1.0
 */
public sealed interface RecordingState
        permits RecordingState.Idle, RecordingState.Recording, RecordingState.Processing,
        RecordingState.Success, RecordingState.Error {

    /** Kind of this state, for switch statements. */
    RecordingStatus status();

    /** Short name used in transition logs. */
    default String name() {
        return status().name();
    }

    static Idle idle() {
        return Idle.INSTANCE;
    }

    /** Nothing is being recorded. */
    record Idle() implements RecordingState {
        static final Idle INSTANCE = new Idle();

        @Override
        public RecordingStatus status() {
            return RecordingStatus.IDLE;
        }
    }

    /**
     * Capture is running.
     *
     * @param sessionId  capture session identifier
     * @param startTime  when capture started
     * @param durationMs elapsed time at the last duration tick
     */
    record Recording(String sessionId, Instant startTime, long durationMs) implements RecordingState {
        public Recording {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
            Objects.requireNonNull(startTime, "startTime must not be null");
        }

        public Recording withDuration(long newDurationMs) {
            return new Recording(sessionId, startTime, newDurationMs);
        }

        @Override
        public RecordingStatus status() {
            return RecordingStatus.RECORDING;
        }
    }

    /**
     * Capture stopped; the recording is being encoded and transcribed.
     *
     * @param progress percentage in [0, 100]
     */
    record Processing(int progress) implements RecordingState {
        public Processing {
            if (progress < 0 || progress > 100) {
                throw new IllegalArgumentException("progress must be in [0, 100], got: " + progress);
            }
        }

        @Override
        public RecordingStatus status() {
            return RecordingStatus.PROCESSING;
        }
    }

    /**
     * The recording was transcribed.
     *
     * @param audioFile     the uploaded WAV file
     * @param transcription the transcription service result
     */
    record Success(AudioFile audioFile, TranscriptionResult transcription) implements RecordingState {
        public Success {
            Objects.requireNonNull(audioFile, "audioFile must not be null");
            Objects.requireNonNull(transcription, "transcription must not be null");
        }

        @Override
        public RecordingStatus status() {
            return RecordingStatus.SUCCESS;
        }
    }

    /**
     * The recording failed.
     *
     * @param message   user-facing description of the failure
     * @param retryable whether {@code retryFromError} may return to Idle
     */
    record Error(String message, boolean retryable) implements RecordingState {
        public Error {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public RecordingStatus status() {
            return RecordingStatus.ERROR;
        }
    }
}
