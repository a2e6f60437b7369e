package com.phillippitts.voicecapture.service.orchestration;

import com.phillippitts.voicecapture.domain.RecordingState;
import com.phillippitts.voicecapture.service.audio.quality.AudioMetrics;
import com.phillippitts.voicecapture.service.audio.quality.RecordingStatistics;

import java.util.concurrent.CompletableFuture;

/**
 * Drives the single foreground recording through its lifecycle.
 *
 * <p><b>State machine:</b>
 * <pre>
 * Idle       --start-------------------------&gt; Recording
 * Recording  --stop--------------------------&gt; Processing --transcribed--&gt; Success --display timer--&gt; Idle
 * Processing --transcription failed----------&gt; Error(retryable)
 * Recording  --timeout-----------------------&gt; Error(not retryable)
 * Recording  --capture failure, device loss--&gt; Error(retryable)
 * Error      --retryFromError [retryable]----&gt; Idle
 * Success    --retryFromError----------------&gt; Idle
 * any        --cancelRecording---------------&gt; Idle
 * </pre>
 *
 * <p><b>Threading:</b> every public command is queued on a single orchestration thread and
 * returns immediately. The returned future completes once the command has been applied (or
 * ignored because the state did not allow it). Commands never complete exceptionally for
 * recording failures; those become {@link RecordingState.Error} states.
 *
 * @since 1.1
 */
public interface RecordingOrchestrator {

    /** Starts a recording. Ignored unless the state is exactly Idle. */
    CompletableFuture<Void> startRecording();

    /** Stops the recording and transcribes it. Ignored unless the state is exactly Recording. */
    CompletableFuture<Void> stopRecording();

    /** Abandons whatever is in progress, discards the recording and returns to Idle. */
    CompletableFuture<Void> cancelRecording();

    /** Returns to Idle from a retryable Error or from Success. Ignored otherwise. */
    CompletableFuture<Void> retryFromError();

    RecordingState currentState();

    void addListener(RecordingStateListener listener);

    void removeListener(RecordingStateListener listener);

    /** Live metrics of the latest captured buffer. */
    AudioMetrics currentMetrics();

    /** Live statistics of the active capture. */
    RecordingStatistics currentStatistics();
}
