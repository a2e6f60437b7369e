package com.phillippitts.voicecapture.service.orchestration;

import com.phillippitts.voicecapture.config.recording.RecordingProperties;
import com.phillippitts.voicecapture.domain.RecordingConstraints;
import com.phillippitts.voicecapture.service.audio.arbitration.AudioDeviceArbiter;
import com.phillippitts.voicecapture.service.audio.capture.AudioCaptureService;
import com.phillippitts.voicecapture.service.audio.output.OutputPathProvider;
import com.phillippitts.voicecapture.service.metrics.RecordingMetrics;
import com.phillippitts.voicecapture.service.permission.PermissionGate;
import com.phillippitts.voicecapture.service.transcription.SettingsProvider;
import com.phillippitts.voicecapture.service.transcription.TranscriptionClient;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultRecordingOrchestrator} to simplify construction with many dependencies.
 *
 * <p>Timing defaults come from {@link RecordingConstraints} (maximum recording duration) and
 * {@link RecordingProperties} (duration tick, progress step delay, success display delay).
 * Each can be overridden individually, which tests use to shorten the timers.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * RecordingOrchestrator orchestrator = RecordingOrchestratorBuilder.builder()
 *     .captureService(captureService)
 *     .arbiter(arbiter)
 *     .permissionGate(permissionGate)
 *     .outputPathProvider(outputPaths)
 *     .settingsProvider(settings)
 *     .transcriptionClient(client)
 *     .executor(recordingExecutor)
 *     .transcriptionExecutor(transcriptionExecutor)
 *     .scheduler(recordingScheduler)
 *     .publisher(publisher)
 *     .constraints(constraints)
 *     .recordingProperties(props)
 *     .build();
 * }</pre>
 *
 * @since 1.1
 */
public final class RecordingOrchestratorBuilder {

    // Required dependencies
    private AudioCaptureService captureService;
    private AudioDeviceArbiter arbiter;
    private PermissionGate permissionGate;
    private OutputPathProvider outputPathProvider;
    private SettingsProvider settingsProvider;
    private TranscriptionClient transcriptionClient;
    private Executor executor;
    private Executor transcriptionExecutor;
    private TaskScheduler scheduler;
    private ApplicationEventPublisher publisher;

    // Optional dependencies
    private RecordingStateMachine stateMachine;
    private RecordingMetrics metrics;
    private Clock clock;
    private RecordingConstraints constraints;
    private RecordingProperties recordingProperties;
    private Duration maxRecordingDuration;
    private Duration durationTick;
    private Duration progressStepDelay;
    private Duration successDisplayDelay;

    private RecordingOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static RecordingOrchestratorBuilder builder() {
        return new RecordingOrchestratorBuilder();
    }

    public RecordingOrchestratorBuilder captureService(AudioCaptureService captureService) {
        this.captureService = captureService;
        return this;
    }

    public RecordingOrchestratorBuilder arbiter(AudioDeviceArbiter arbiter) {
        this.arbiter = arbiter;
        return this;
    }

    public RecordingOrchestratorBuilder permissionGate(PermissionGate permissionGate) {
        this.permissionGate = permissionGate;
        return this;
    }

    public RecordingOrchestratorBuilder outputPathProvider(OutputPathProvider outputPathProvider) {
        this.outputPathProvider = outputPathProvider;
        return this;
    }

    public RecordingOrchestratorBuilder settingsProvider(SettingsProvider settingsProvider) {
        this.settingsProvider = settingsProvider;
        return this;
    }

    public RecordingOrchestratorBuilder transcriptionClient(TranscriptionClient transcriptionClient) {
        this.transcriptionClient = transcriptionClient;
        return this;
    }

    /**
     * Sets the orchestration executor.
     *
     * @param executor executor running one task at a time in submission order (required)
     * @return this builder
     */
    public RecordingOrchestratorBuilder executor(Executor executor) {
        this.executor = executor;
        return this;
    }

    /**
     * Sets the executor running transcription requests.
     *
     * @param transcriptionExecutor executor other than the orchestration executor (required)
     * @return this builder
     */
    public RecordingOrchestratorBuilder transcriptionExecutor(Executor transcriptionExecutor) {
        this.transcriptionExecutor = transcriptionExecutor;
        return this;
    }

    public RecordingOrchestratorBuilder scheduler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    public RecordingOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * Sets the state machine; a fresh one is created when omitted.
     *
     * @param stateMachine recording state holder (optional)
     * @return this builder
     */
    public RecordingOrchestratorBuilder stateMachine(RecordingStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        return this;
    }

    public RecordingOrchestratorBuilder metrics(RecordingMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public RecordingOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public RecordingOrchestratorBuilder constraints(RecordingConstraints constraints) {
        this.constraints = constraints;
        return this;
    }

    public RecordingOrchestratorBuilder recordingProperties(RecordingProperties recordingProperties) {
        this.recordingProperties = recordingProperties;
        return this;
    }

    public RecordingOrchestratorBuilder maxRecordingDuration(Duration maxRecordingDuration) {
        this.maxRecordingDuration = maxRecordingDuration;
        return this;
    }

    public RecordingOrchestratorBuilder durationTick(Duration durationTick) {
        this.durationTick = durationTick;
        return this;
    }

    public RecordingOrchestratorBuilder progressStepDelay(Duration progressStepDelay) {
        this.progressStepDelay = progressStepDelay;
        return this;
    }

    public RecordingOrchestratorBuilder successDisplayDelay(Duration successDisplayDelay) {
        this.successDisplayDelay = successDisplayDelay;
        return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @return configured orchestrator
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultRecordingOrchestrator build() {
        Objects.requireNonNull(captureService, "captureService is required");
        Objects.requireNonNull(arbiter, "arbiter is required");
        Objects.requireNonNull(permissionGate, "permissionGate is required");
        Objects.requireNonNull(outputPathProvider, "outputPathProvider is required");
        Objects.requireNonNull(settingsProvider, "settingsProvider is required");
        Objects.requireNonNull(transcriptionClient, "transcriptionClient is required");
        Objects.requireNonNull(executor, "executor is required");
        Objects.requireNonNull(transcriptionExecutor, "transcriptionExecutor is required");
        Objects.requireNonNull(scheduler, "scheduler is required");
        Objects.requireNonNull(publisher, "publisher is required");

        RecordingConstraints effectiveConstraints = constraints != null ? constraints : RecordingConstraints.defaults();
        RecordingProperties props = recordingProperties != null
                ? recordingProperties
                : new RecordingProperties(null, 1500, 100, 50);

        return new DefaultRecordingOrchestrator(
                captureService,
                arbiter,
                permissionGate,
                outputPathProvider,
                settingsProvider,
                transcriptionClient,
                stateMachine != null ? stateMachine : new RecordingStateMachine(),
                executor,
                transcriptionExecutor,
                scheduler,
                publisher,
                metrics != null ? metrics : RecordingMetrics.inMemory(),
                clock != null ? clock : Clock.systemUTC(),
                orDefault(maxRecordingDuration, Duration.ofMillis(effectiveConstraints.maxRecordingDurationMs())),
                orDefault(durationTick, Duration.ofMillis(props.getDurationTickMs())),
                orDefault(progressStepDelay, Duration.ofMillis(props.getProgressStepDelayMs())),
                orDefault(successDisplayDelay, Duration.ofMillis(props.getSuccessDisplayDelayMs())));
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        return value != null ? value : fallback;
    }
}
