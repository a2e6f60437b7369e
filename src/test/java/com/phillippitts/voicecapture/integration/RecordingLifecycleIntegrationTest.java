package com.phillippitts.voicecapture.integration;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.RecordingConstraints;
import com.phillippitts.voicecapture.domain.RecordingState;
import com.phillippitts.voicecapture.domain.TranscriptionResult;
import com.phillippitts.voicecapture.domain.TranscriptionSettings;
import com.phillippitts.voicecapture.exception.TranscriptionException;
import com.phillippitts.voicecapture.service.audio.arbitration.PriorityDeviceArbiter;
import com.phillippitts.voicecapture.service.audio.capture.JavaSoundAudioCaptureService;
import com.phillippitts.voicecapture.service.audio.capture.TestCaptureServices;
import com.phillippitts.voicecapture.service.audio.output.TimestampedOutputPathProvider;
import com.phillippitts.voicecapture.service.orchestration.DefaultRecordingOrchestrator;
import com.phillippitts.voicecapture.service.orchestration.RecordingOrchestratorBuilder;
import com.phillippitts.voicecapture.service.orchestration.RecordingStateListener;
import com.phillippitts.voicecapture.service.transcription.TranscriptionClient;
import com.phillippitts.voicecapture.testutil.EventCapturingPublisher;
import com.phillippitts.voicecapture.testutil.SyncExecutor;
import com.phillippitts.voicecapture.testutil.SyntheticTargetDataLine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

/**
 * Integration test driving the real orchestrator over the real Java Sound capture engine.
 *
 * <p>Flow: start → audio-capture thread reads a synthetic line → stop → WAV finalized
 * → processing progress → transcription client → Success → Idle.
 *
 * <p>The microphone is replaced by {@link SyntheticTargetDataLine}; everything else (capture
 * thread, silence analysis, processing, WAV encoding, device arbitration, timers) is real.
 */
class RecordingLifecycleIntegrationTest {

    private static final long TIMEOUT_SECONDS = 10;

    @TempDir
    Path dir;

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final PriorityDeviceArbiter arbiter = new PriorityDeviceArbiter(new SyncExecutor());
    private final RecordingClient client = new RecordingClient();
    private final List<String> errors = new CopyOnWriteArrayList<>();

    private ExecutorService executor;
    private ExecutorService transcriptionPool;
    private ThreadPoolTaskScheduler scheduler;
    private JavaSoundAudioCaptureService capture;
    private DefaultRecordingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "recording-it"));
        transcriptionPool = Executors.newSingleThreadExecutor(r -> new Thread(r, "transcription-it"));
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
        scheduler.shutdown();
        executor.shutdownNow();
        executor.awaitTermination(2, TimeUnit.SECONDS);
        transcriptionPool.shutdownNow();
    }

    @Test
    void recordsTranscribesAndReturnsToIdle() throws Exception {
        // Arrange
        wire(RecordingConstraints.defaults(), (fmt, dev) -> open(SyntheticTargetDataLine.tone(fmt)));

        // Act
        orchestrator.startRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        Thread.sleep(1_500);
        orchestrator.stopRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // Assert
        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .until(() -> orchestrator.currentState() instanceof RecordingState.Success);
        AudioFile audio = ((RecordingState.Success) orchestrator.currentState()).audioFile();
        assertThat(audio.durationMs()).isCloseTo(1_500L, within(400L));
        assertThat(Files.size(audio.path())).isEqualTo(audio.sizeBytes());
        assertThat(audio.path().getFileName().toString()).startsWith("recording_").endsWith(".wav");
        assertThat(client.received).containsExactly(audio);
        assertThat(arbiter.currentHolder()).isNull();

        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .until(() -> orchestrator.currentState() instanceof RecordingState.Idle);
    }

    @Test
    void retriesAfterTranscriptionFailureAndRecordsAgain() throws Exception {
        // Arrange
        wire(RecordingConstraints.defaults(), (fmt, dev) -> open(SyntheticTargetDataLine.tone(fmt)));
        client.answer = audio -> {
            throw new TranscriptionException("Service unavailable", "whisper-1");
        };

        // Act: first attempt fails in transcription
        orchestrator.startRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        Thread.sleep(300);
        orchestrator.stopRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .until(() -> orchestrator.currentState() instanceof RecordingState.Error);
        assertThat(((RecordingState.Error) orchestrator.currentState()).retryable()).isTrue();

        // Act: retry, then record again with a working service
        orchestrator.retryFromError().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(orchestrator.currentState()).isEqualTo(RecordingState.idle());
        client.answer = audio -> TranscriptionResult.of("second try");
        orchestrator.startRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        Thread.sleep(300);
        orchestrator.stopRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // Assert
        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .until(() -> orchestrator.currentState() instanceof RecordingState.Success);
        assertThat(((RecordingState.Success) orchestrator.currentState()).transcription().text())
                .isEqualTo("second try");
        assertThat(client.calls.get()).isEqualTo(2);
        assertThat(errors).hasSize(1);
    }

    @Test
    void sizeLimitEndsRecordingWithFileWithinLimit() throws Exception {
        // Arrange: roughly two seconds of audio fit the limit
        RecordingConstraints small = RecordingConstraints.defaults().withMaxFileSizeBytes(64_044);
        wire(small, (fmt, dev) -> open(SyntheticTargetDataLine.fastTone(fmt)));

        // Act
        orchestrator.startRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // Assert
        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .until(() -> orchestrator.currentState() instanceof RecordingState.Success);
        AudioFile audio = ((RecordingState.Success) orchestrator.currentState()).audioFile();
        assertThat(audio.sizeBytes()).isLessThanOrEqualTo(small.maxFileSizeBytes());
        assertThat(Files.size(audio.path())).isEqualTo(audio.sizeBytes());
        assertThat(errors).singleElement().asString().startsWith("Recording size limit reached");
        assertThat(client.calls.get()).isEqualTo(1);
    }

    @Test
    void cancelDiscardsRecordingAndReleasesDevice() throws Exception {
        // Arrange
        wire(RecordingConstraints.defaults(), (fmt, dev) -> open(SyntheticTargetDataLine.tone(fmt)));
        orchestrator.startRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        Thread.sleep(300);

        // Act
        orchestrator.cancelRecording().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // Assert
        assertThat(orchestrator.currentState()).isEqualTo(RecordingState.idle());
        assertThat(capture.isCapturing()).isFalse();
        assertThat(arbiter.currentHolder()).isNull();
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.filter(p -> p.toString().endsWith(".wav"))).isEmpty();
        }
        assertThat(client.calls.get()).isZero();
    }

    private void wire(RecordingConstraints constraints, JavaSoundAudioCaptureService.DataLineProvider provider) {
        capture = TestCaptureServices.withLine(constraints, publisher, provider);
        orchestrator = RecordingOrchestratorBuilder.builder()
                .captureService(capture)
                .arbiter(arbiter)
                .permissionGate(() -> true)
                .outputPathProvider(new TimestampedOutputPathProvider(dir))
                .settingsProvider(() -> new TranscriptionSettings("en", "whisper-1", "", 0.0))
                .transcriptionClient(client)
                .executor(executor)
                .transcriptionExecutor(transcriptionPool)
                .scheduler(scheduler)
                .publisher(publisher)
                .constraints(constraints)
                .durationTick(Duration.ofMillis(50))
                .progressStepDelay(Duration.ofMillis(5))
                .successDisplayDelay(Duration.ofMillis(500))
                .build();
        orchestrator.addListener(new RecordingStateListener() {
            @Override
            public void onRecordingError(String message) {
                errors.add(message);
            }
        });
    }

    private static SyntheticTargetDataLine open(SyntheticTargetDataLine line) {
        line.open();
        return line;
    }

    private static final class RecordingClient implements TranscriptionClient {
        final AtomicInteger calls = new AtomicInteger();
        final List<AudioFile> received = new CopyOnWriteArrayList<>();
        volatile Function<AudioFile, TranscriptionResult> answer = audio -> TranscriptionResult.of("hello world");

        @Override
        public TranscriptionResult transcribe(AudioFile audio, TranscriptionSettings settings) {
            calls.incrementAndGet();
            received.add(audio);
            return answer.apply(audio);
        }
    }
}
