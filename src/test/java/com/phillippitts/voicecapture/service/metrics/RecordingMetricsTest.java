package com.phillippitts.voicecapture.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingMetricsTest {

    private MeterRegistry registry;
    private RecordingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RecordingMetrics(registry);
    }

    @Test
    void shouldCountStartedRecordings() {
        metrics.recordingStarted();
        metrics.recordingStarted();

        Counter counter = registry.find("voicecapture.recording.started").counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void shouldRecordDurationAndSizeOfCompletedRecordings() {
        metrics.recordingCompleted(5_000, 160_044);
        metrics.recordingCompleted(1_000, 32_044);

        Counter completed = registry.find("voicecapture.recording.completed").counter();
        Timer duration = registry.find("voicecapture.recording.duration").timer();
        DistributionSummary size = registry.find("voicecapture.recording.file.size").summary();

        assertThat(completed.count()).isEqualTo(2.0);
        assertThat(duration.count()).isEqualTo(2);
        assertThat(duration.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(6_000);
        assertThat(size.totalAmount()).isEqualTo(192_088.0);
        assertThat(size.max()).isEqualTo(160_044.0);
    }

    @Test
    void shouldTagFailuresByKind() {
        metrics.recordingFailed("TIMEOUT");
        metrics.recordingFailed("TRANSCRIPTION");
        metrics.recordingFailed("TRANSCRIPTION");

        assertThat(registry.find("voicecapture.recording.failed").tag("kind", "TIMEOUT").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("voicecapture.recording.failed").tag("kind", "TRANSCRIPTION").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountSizeLimitStops() {
        metrics.sizeLimitReached();

        assertThat(registry.find("voicecapture.capture.size_limit").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldSeparateTranscriptionLatencyByOutcome() {
        metrics.recordTranscriptionLatency(TimeUnit.MILLISECONDS.toNanos(300), true);
        metrics.recordTranscriptionLatency(TimeUnit.MILLISECONDS.toNanos(100), false);

        Timer ok = registry.find("voicecapture.transcription.latency").tag("outcome", "success").timer();
        Timer failed = registry.find("voicecapture.transcription.latency").tag("outcome", "failure").timer();

        assertThat(ok.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(300);
        assertThat(failed.count()).isEqualTo(1);
    }

    @Test
    void inMemoryRecorderAcceptsEveryCall() {
        RecordingMetrics standalone = RecordingMetrics.inMemory();

        standalone.recordingStarted();
        standalone.recordingCompleted(10, 64);
        standalone.recordingFailed("IO_ERROR");
        standalone.sizeLimitReached();
        standalone.recordTranscriptionLatency(1, true);
    }
}
