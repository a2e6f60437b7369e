package com.phillippitts.voicecapture.config.orchestration;

import com.phillippitts.voicecapture.config.recording.RecordingProperties;
import com.phillippitts.voicecapture.config.recording.TranscriptionProperties;
import com.phillippitts.voicecapture.domain.RecordingConstraints;
import com.phillippitts.voicecapture.service.audio.arbitration.AudioDeviceArbiter;
import com.phillippitts.voicecapture.service.audio.capture.AudioCaptureService;
import com.phillippitts.voicecapture.service.audio.output.OutputPathProvider;
import com.phillippitts.voicecapture.service.audio.output.TimestampedOutputPathProvider;
import com.phillippitts.voicecapture.service.metrics.RecordingMetrics;
import com.phillippitts.voicecapture.service.orchestration.DefaultRecordingOrchestrator;
import com.phillippitts.voicecapture.service.orchestration.RecordingOrchestratorBuilder;
import com.phillippitts.voicecapture.service.orchestration.RecordingStateMachine;
import com.phillippitts.voicecapture.service.permission.JavaSoundPermissionGate;
import com.phillippitts.voicecapture.service.permission.PermissionGate;
import com.phillippitts.voicecapture.service.transcription.PropertiesSettingsProvider;
import com.phillippitts.voicecapture.service.transcription.SettingsProvider;
import com.phillippitts.voicecapture.service.transcription.TranscriptionClient;
import com.phillippitts.voicecapture.service.transcription.UnconfiguredTranscriptionClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Wires the recording orchestrator and the default implementations of its collaborators.
 *
 * <p>Each collaborator default backs off when the application defines its own bean, so a
 * real transcription client or settings store replaces the shipped placeholder by simply
 * being present.
 */
@Configuration
public class OrchestrationConfig {

    private final RecordingProperties recordingProperties;

    public OrchestrationConfig(RecordingProperties recordingProperties) {
        this.recordingProperties = recordingProperties;
    }

    @Bean
    public RecordingStateMachine recordingStateMachine() {
        return new RecordingStateMachine();
    }

    @Bean
    @ConditionalOnMissingBean(PermissionGate.class)
    public PermissionGate permissionGate() {
        return new JavaSoundPermissionGate();
    }

    @Bean
    @ConditionalOnMissingBean(OutputPathProvider.class)
    public OutputPathProvider outputPathProvider() {
        return new TimestampedOutputPathProvider(Path.of(recordingProperties.getOutputDir()));
    }

    @Bean
    @ConditionalOnMissingBean(SettingsProvider.class)
    public SettingsProvider settingsProvider(TranscriptionProperties transcriptionProperties) {
        return new PropertiesSettingsProvider(transcriptionProperties);
    }

    /**
     * Placeholder client failing every request. Active when no other client bean exists.
     */
    @Bean
    @ConditionalOnMissingBean(TranscriptionClient.class)
    public TranscriptionClient transcriptionClient() {
        return new UnconfiguredTranscriptionClient();
    }

    // CHECKSTYLE.OFF: ParameterNumber - Bean method aggregates the orchestrator's collaborators
    @Bean(destroyMethod = "shutdown")
    public DefaultRecordingOrchestrator recordingOrchestrator(AudioCaptureService captureService,
                                                              AudioDeviceArbiter arbiter,
                                                              PermissionGate permissionGate,
                                                              OutputPathProvider outputPathProvider,
                                                              SettingsProvider settingsProvider,
                                                              TranscriptionClient transcriptionClient,
                                                              RecordingStateMachine recordingStateMachine,
                                                              @Qualifier("recordingExecutor") Executor executor,
                                                              @Qualifier("transcriptionExecutor")
                                                              Executor transcriptionExecutor,
                                                              @Qualifier("recordingScheduler") TaskScheduler scheduler,
                                                              ApplicationEventPublisher publisher,
                                                              RecordingMetrics metrics,
                                                              RecordingConstraints constraints) {
        return RecordingOrchestratorBuilder.builder()
                .captureService(captureService)
                .arbiter(arbiter)
                .permissionGate(permissionGate)
                .outputPathProvider(outputPathProvider)
                .settingsProvider(settingsProvider)
                .transcriptionClient(transcriptionClient)
                .stateMachine(recordingStateMachine)
                .executor(executor)
                .transcriptionExecutor(transcriptionExecutor)
                .scheduler(scheduler)
                .publisher(publisher)
                .metrics(metrics)
                .constraints(constraints)
                .recordingProperties(recordingProperties)
                .build();
    }
    // CHECKSTYLE.ON: ParameterNumber
}
