package com.phillippitts.voicecapture.service.orchestration;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.RecordingState;
import com.phillippitts.voicecapture.domain.RecordingStatus;
import com.phillippitts.voicecapture.domain.TranscriptionResult;
import com.phillippitts.voicecapture.domain.TranscriptionSettings;
import com.phillippitts.voicecapture.exception.CaptureErrorKind;
import com.phillippitts.voicecapture.exception.CaptureException;
import com.phillippitts.voicecapture.exception.RecordingTimeoutException;
import com.phillippitts.voicecapture.exception.TranscriptionException;
import com.phillippitts.voicecapture.service.audio.arbitration.AudioDeviceArbiter;
import com.phillippitts.voicecapture.service.audio.arbitration.DeviceFocusChange;
import com.phillippitts.voicecapture.service.audio.arbitration.DeviceFocusHandle;
import com.phillippitts.voicecapture.service.audio.capture.AudioCaptureService;
import com.phillippitts.voicecapture.service.audio.capture.CaptureListener;
import com.phillippitts.voicecapture.service.audio.output.OutputPathProvider;
import com.phillippitts.voicecapture.service.audio.quality.AudioMetrics;
import com.phillippitts.voicecapture.service.audio.quality.RecordingStatistics;
import com.phillippitts.voicecapture.service.metrics.RecordingMetrics;
import com.phillippitts.voicecapture.service.orchestration.event.RecordingStateChangedEvent;
import com.phillippitts.voicecapture.service.permission.PermissionGate;
import com.phillippitts.voicecapture.service.transcription.SettingsProvider;
import com.phillippitts.voicecapture.service.transcription.TranscriptionClient;
import com.phillippitts.voicecapture.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Default {@link RecordingOrchestrator}: sequences permission check, device arbitration,
 * capture, processing and transcription for one foreground recording at a time.
 *
 * <p><b>Threading:</b> all session bookkeeping is confined to the orchestration executor, which
 * must run tasks one at a time in submission order. Timers (recording timeout, live duration
 * ticks, processing progress steps, success display delay) fire on the scheduler and only
 * queue work back onto the executor. Capture-thread and arbiter callbacks do the same.
 * Every queued task names the session it belongs to and is dropped when that session is no
 * longer current, so a late timer never touches a newer recording.
 *
 * <p>Transcription requests run on a separate executor. Their result is queued back onto the
 * orchestration executor under the same session check, so cancel stays immediate during a
 * slow request and a result arriving after cancel is dropped.
 *
 * <p><b>Error Handling:</b> every failure goes through {@link #fail}: timers are cancelled,
 * capture is cancelled, the device is released and the state becomes
 * {@link RecordingState.Error}. Only the recording timeout produces a non-retryable error.
 *
 * <p><b>Configuration:</b> Not annotated as {@code @Component}; see
 * {@link com.phillippitts.voicecapture.config.orchestration.OrchestrationConfig} for bean wiring
 * and {@link RecordingOrchestratorBuilder} for construction.
 *
 * @since 1.1
 */
public class DefaultRecordingOrchestrator implements RecordingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultRecordingOrchestrator.class);

    private static final String MDC_SESSION = "sessionId";
    private static final int PROGRESS_STEP = 10;
    private static final int MAX_LOGGED_TEXT = 80;

    private final AudioCaptureService captureService;
    private final AudioDeviceArbiter arbiter;
    private final PermissionGate permissionGate;
    private final OutputPathProvider outputPaths;
    private final SettingsProvider settingsProvider;
    private final TranscriptionClient transcriptionClient;
    private final RecordingStateMachine stateMachine;
    private final Executor executor;
    private final Executor transcriptionExecutor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final RecordingMetrics metrics;
    private final Clock clock;
    private final Duration maxRecordingDuration;
    private final Duration durationTick;
    private final Duration progressStepDelay;
    private final Duration successDisplayDelay;

    // Written only on the orchestration executor; volatile for shutdown()
    private volatile ActiveSession session;
    private ScheduledFuture<?> successReset;

    // CHECKSTYLE.OFF: ParameterNumber - Package-private constructor only used by builder
    DefaultRecordingOrchestrator(AudioCaptureService captureService,
                                 AudioDeviceArbiter arbiter,
                                 PermissionGate permissionGate,
                                 OutputPathProvider outputPaths,
                                 SettingsProvider settingsProvider,
                                 TranscriptionClient transcriptionClient,
                                 RecordingStateMachine stateMachine,
                                 Executor executor,
                                 Executor transcriptionExecutor,
                                 TaskScheduler scheduler,
                                 ApplicationEventPublisher publisher,
                                 RecordingMetrics metrics,
                                 Clock clock,
                                 Duration maxRecordingDuration,
                                 Duration durationTick,
                                 Duration progressStepDelay,
                                 Duration successDisplayDelay) {
        this.captureService = captureService;
        this.arbiter = arbiter;
        this.permissionGate = permissionGate;
        this.outputPaths = outputPaths;
        this.settingsProvider = settingsProvider;
        this.transcriptionClient = transcriptionClient;
        this.stateMachine = stateMachine;
        this.executor = executor;
        this.transcriptionExecutor = transcriptionExecutor;
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
        this.maxRecordingDuration = maxRecordingDuration;
        this.durationTick = durationTick;
        this.progressStepDelay = progressStepDelay;
        this.successDisplayDelay = successDisplayDelay;
        this.stateMachine.addListener(new EventPublishingListener());
    }
    // CHECKSTYLE.ON: ParameterNumber

    @Override
    public CompletableFuture<Void> startRecording() {
        return submit("start", this::doStart);
    }

    @Override
    public CompletableFuture<Void> stopRecording() {
        return submit("stop", () -> {
            ActiveSession s = session;
            if (s == null) {
                LOG.debug("stopRecording ignored; state is {}", stateMachine.current().name());
                return;
            }
            doStop(s);
        });
    }

    @Override
    public CompletableFuture<Void> cancelRecording() {
        return submit("cancel", this::doCancel);
    }

    @Override
    public CompletableFuture<Void> retryFromError() {
        return submit("retry", () -> {
            RecordingState state = stateMachine.current();
            if (state instanceof RecordingState.Error error) {
                if (!error.retryable()) {
                    LOG.info("Retry refused; error is not retryable: {}", error.message());
                    return;
                }
                stateMachine.compareAndSet(error, RecordingState.idle());
            } else if (state instanceof RecordingState.Success) {
                cancelSuccessReset();
                stateMachine.compareAndSet(state, RecordingState.idle());
            } else {
                LOG.debug("retryFromError ignored; state is {}", state.name());
            }
        });
    }

    @Override
    public RecordingState currentState() {
        return stateMachine.current();
    }

    @Override
    public void addListener(RecordingStateListener listener) {
        stateMachine.addListener(listener);
    }

    @Override
    public void removeListener(RecordingStateListener listener) {
        stateMachine.removeListener(listener);
    }

    @Override
    public AudioMetrics currentMetrics() {
        return captureService.currentMetrics();
    }

    @Override
    public RecordingStatistics currentStatistics() {
        return captureService.currentStatistics();
    }

    /**
     * Releases the device and discards any capture in progress. Called on context shutdown,
     * possibly while the orchestration executor is still running.
     */
    public void shutdown() {
        ActiveSession s = session;
        session = null;
        if (s != null) {
            LOG.info("Shutting down with active recording {}", s.id);
            s.cancelPending();
            s.focus.release();
        }
        captureService.cancel();
    }

    private void doStart() {
        if (!stateMachine.is(RecordingStatus.IDLE)) {
            LOG.debug("startRecording ignored; state is {}", stateMachine.current().name());
            return;
        }
        String id = UUID.randomUUID().toString();
        ThreadContext.put(MDC_SESSION, id);

        if (!permissionGate.isRecordingPermitted()) {
            failBeforeCapture(new CaptureException(CaptureErrorKind.PERMISSION_DENIED));
            return;
        }

        DeviceFocusHandle focus = arbiter.newHandle("recording-" + id);
        boolean granted = focus.acquire(change -> enqueue("focus " + change, () -> onFocusChange(id, change)));
        if (!granted) {
            failBeforeCapture(new CaptureException(CaptureErrorKind.DEVICE_UNAVAILABLE,
                    "device held by " + arbiter.currentHolder()));
            return;
        }

        Path output;
        try {
            output = outputPaths.newOutputPath(id);
            captureService.start(id, output, new SessionCaptureListener(id));
        } catch (CaptureException e) {
            focus.release();
            failBeforeCapture(e);
            return;
        } catch (RuntimeException e) {
            LOG.error("Recording start failed unexpectedly", e);
            focus.release();
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            failBeforeCapture(new CaptureException(CaptureErrorKind.UNKNOWN, detail, e));
            return;
        }

        Instant startedAt = clock.instant();
        ActiveSession s = new ActiveSession(id, focus, startedAt);
        session = s;
        stateMachine.compareAndSet(RecordingState.idle(), new RecordingState.Recording(id, startedAt, 0));
        metrics.recordingStarted();

        s.timeout = scheduler.schedule(() -> enqueue("timeout", () -> onTimeout(id)),
                startedAt.plus(maxRecordingDuration));
        s.ticker = scheduler.scheduleAtFixedRate(() -> enqueue("tick", () -> onTick(id)),
                startedAt.plus(durationTick), durationTick);
        LOG.info("Recording started (output={}, limit={} ms)", output.getFileName(), maxRecordingDuration.toMillis());
    }

    private void doStop(ActiveSession s) {
        if (stateMachine.transitionFrom(RecordingStatus.RECORDING, new RecordingState.Processing(0)) == null) {
            return;
        }
        s.cancelPending();
        Optional<AudioFile> file = captureService.stop();
        s.focus.release();
        if (file.isEmpty()) {
            fail(s, new CaptureException(CaptureErrorKind.IO_ERROR, "no audio captured").getMessage(),
                    true, CaptureErrorKind.IO_ERROR.name());
            return;
        }
        AudioFile audio = file.get();
        s.audio = audio;
        LOG.info("Recording finalized: {} ms, {} bytes", audio.durationMs(), audio.sizeBytes());
        stateMachine.fireRecordingComplete(audio);
        s.settings = settingsProvider.currentSettings();
        scheduleProgress(s, 0);
    }

    private void scheduleProgress(ActiveSession s, int reached) {
        s.progressStep = scheduler.schedule(() -> enqueue("progress", () -> onProgress(s, reached)),
                clock.instant().plus(progressStepDelay));
    }

    private void onProgress(ActiveSession s, int reached) {
        if (session != s) {
            return;
        }
        if (reached >= 100) {
            transcribe(s);
            return;
        }
        int next = reached + PROGRESS_STEP;
        if (stateMachine.compareAndSet(new RecordingState.Processing(reached), new RecordingState.Processing(next))) {
            scheduleProgress(s, next);
        }
    }

    private void transcribe(ActiveSession s) {
        TranscriptionSettings settings = s.settings;
        AudioFile audio = s.audio;
        long startNanos = System.nanoTime();
        s.transcription = CompletableFuture.supplyAsync(
                () -> transcriptionClient.transcribe(audio, settings), transcriptionExecutor);
        s.transcription.whenComplete((result, error) -> enqueue("transcription-result",
                () -> onTranscribed(s, result, error, System.nanoTime() - startNanos)));
    }

    private void onTranscribed(ActiveSession s, TranscriptionResult result, Throwable error, long elapsedNanos) {
        if (session != s) {
            LOG.debug("Discarding transcription result of an abandoned recording");
            return;
        }
        TranscriptionSettings settings = s.settings;
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            metrics.recordTranscriptionLatency(elapsedNanos, false);
            if (cause instanceof TranscriptionException e) {
                LOG.warn("Transcription failed: {}", e.getMessage());
                fail(s, e.getMessage(), true, "TRANSCRIPTION");
            } else {
                LOG.error("Transcription client failed unexpectedly", cause);
                fail(s, "Transcription failed: " + cause.getMessage(), true, "TRANSCRIPTION");
            }
            return;
        }
        metrics.recordTranscriptionLatency(elapsedNanos, true);
        session = null;
        RecordingState.Success success = new RecordingState.Success(s.audio, result);
        if (stateMachine.compareAndSet(new RecordingState.Processing(100), success)) {
            metrics.recordingCompleted(s.audio.durationMs(), s.audio.sizeBytes());
            LOG.info("Transcription complete (model={}, chars={}, text='{}')", settings.model(),
                    result.text().length(), LogSanitizer.preview(result.text(), MAX_LOGGED_TEXT));
            cancelSuccessReset();
            successReset = scheduler.schedule(() -> enqueue("success-reset", () -> {
                if (stateMachine.compareAndSet(success, RecordingState.idle())) {
                    LOG.debug("Success display elapsed");
                }
            }), clock.instant().plus(successDisplayDelay));
        }
    }

    private void doCancel() {
        ActiveSession s = session;
        session = null;
        cancelSuccessReset();
        if (s != null) {
            ThreadContext.put(MDC_SESSION, s.id);
            s.cancelPending();
            captureService.cancel();
            s.focus.release();
            LOG.info("Recording canceled");
        } else if (captureService.isCapturing()) {
            captureService.cancel();
        }
        stateMachine.force(RecordingState.idle());
    }

    private void onTick(String id) {
        ActiveSession s = session;
        if (s == null || !s.id.equals(id)) {
            return;
        }
        long elapsed = Duration.between(s.startedAt, clock.instant()).toMillis();
        if (!stateMachine.updateDuration(id, Math.max(0, elapsed)) && s.ticker != null) {
            s.ticker.cancel(false);
        }
    }

    private void onTimeout(String id) {
        ActiveSession s = session;
        if (s == null || !s.id.equals(id) || !stateMachine.is(RecordingStatus.RECORDING)) {
            return;
        }
        RecordingTimeoutException timeout = new RecordingTimeoutException(maxRecordingDuration.toMillis());
        LOG.warn(timeout.getMessage());
        fail(s, timeout.getMessage(), false, "TIMEOUT");
    }

    private void onFocusChange(String id, DeviceFocusChange change) {
        ActiveSession s = session;
        if (s == null || !s.id.equals(id) || !stateMachine.is(RecordingStatus.RECORDING)) {
            return;
        }
        switch (change) {
            case LOSS -> fail(s, new CaptureException(CaptureErrorKind.DEVICE_UNAVAILABLE,
                    "audio device taken by another application").getMessage(),
                    true, CaptureErrorKind.DEVICE_UNAVAILABLE.name());
            case LOSS_TRANSIENT, LOSS_TRANSIENT_CAN_DUCK -> captureService.pause();
            case GAIN -> captureService.resume();
            default -> LOG.debug("Unhandled focus change {}", change);
        }
    }

    private void onCaptureError(String id, CaptureException error) {
        ActiveSession s = session;
        if (s == null || !s.id.equals(id)) {
            return;
        }
        fail(s, error.getMessage(), true, error.getKind().name());
    }

    private void onSizeLimitReached(String id, long fileSizeBytes) {
        ActiveSession s = session;
        if (s == null || !s.id.equals(id)) {
            return;
        }
        metrics.sizeLimitReached();
        CaptureException warning = new CaptureException(CaptureErrorKind.SIZE_LIMIT_REACHED,
                fileSizeBytes + " bytes; recording stopped");
        LOG.info(warning.getMessage());
        stateMachine.fireRecordingError(warning.getMessage());
        doStop(s);
    }

    private void failBeforeCapture(CaptureException e) {
        LOG.warn("Recording could not start: {}", e.getMessage());
        if (stateMachine.compareAndSet(RecordingState.idle(), new RecordingState.Error(e.getMessage(), true))) {
            metrics.recordingFailed(e.getKind().name());
            stateMachine.fireRecordingError(e.getMessage());
        }
    }

    /**
     * Single exit for session failures: cancels timers and capture, releases the device and
     * moves to Error.
     */
    private void fail(ActiveSession s, String message, boolean retryable, String kind) {
        if (session != s) {
            return;
        }
        session = null;
        s.cancelPending();
        captureService.cancel();
        s.focus.release();
        stateMachine.force(new RecordingState.Error(message, retryable));
        metrics.recordingFailed(kind);
        stateMachine.fireRecordingError(message);
    }

    private void cancelSuccessReset() {
        if (successReset != null) {
            successReset.cancel(false);
            successReset = null;
        }
    }

    private CompletableFuture<Void> submit(String command, Runnable task) {
        return CompletableFuture.runAsync(guarded(command, task), executor);
    }

    private void enqueue(String command, Runnable task) {
        executor.execute(guarded(command, task));
    }

    private Runnable guarded(String command, Runnable task) {
        return () -> {
            ActiveSession s = session;
            if (s != null) {
                ThreadContext.put(MDC_SESSION, s.id);
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Recording command '{}' failed", command, e);
                ActiveSession current = session;
                if (current != null) {
                    fail(current, "Unexpected error: " + e.getMessage(), true, CaptureErrorKind.UNKNOWN.name());
                }
            } finally {
                ThreadContext.remove(MDC_SESSION);
            }
        };
    }

    /**
     * Bookkeeping of the recording between start and its terminal state.
     */
    private static final class ActiveSession {
        final String id;
        final DeviceFocusHandle focus;
        final Instant startedAt;
        ScheduledFuture<?> timeout;
        ScheduledFuture<?> ticker;
        ScheduledFuture<?> progressStep;
        CompletableFuture<TranscriptionResult> transcription;
        AudioFile audio;
        TranscriptionSettings settings;

        ActiveSession(String id, DeviceFocusHandle focus, Instant startedAt) {
            this.id = id;
            this.focus = focus;
            this.startedAt = startedAt;
        }

        void cancelPending() {
            for (ScheduledFuture<?> f : new ScheduledFuture<?>[] {timeout, ticker, progressStep}) {
                if (f != null) {
                    f.cancel(false);
                }
            }
            if (transcription != null) {
                transcription.cancel(false);
            }
        }
    }

    /**
     * Routes capture-thread callbacks onto the orchestration executor.
     */
    private final class SessionCaptureListener implements CaptureListener {
        private final String id;

        SessionCaptureListener(String id) {
            this.id = id;
        }

        @Override
        public void onCaptureError(CaptureException error) {
            enqueue("capture-error", () -> DefaultRecordingOrchestrator.this.onCaptureError(id, error));
        }

        @Override
        public void onSizeLimitReached(long fileSizeBytes) {
            enqueue("size-limit", () -> DefaultRecordingOrchestrator.this.onSizeLimitReached(id, fileSizeBytes));
        }
    }

    /**
     * Publishes lifecycle transitions as application events. Live duration updates are not
     * published.
     */
    private final class EventPublishingListener implements RecordingStateListener {
        @Override
        public void onStateChanged(RecordingState previous, RecordingState current) {
            if (previous.status() == current.status() && current.status() == RecordingStatus.RECORDING) {
                return;
            }
            publisher.publishEvent(new RecordingStateChangedEvent(previous, current, clock.instant()));
        }
    }
}
