package com.phillippitts.voicecapture.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for recording sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Sessions started, completed and failed (tagged by failure kind)</li>
 *   <li>Recorded duration and encoded file size of completed sessions</li>
 *   <li>Captures force-stopped by the file size limit</li>
 *   <li>Transcription latency per outcome</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RecordingMetrics {

    private static final String METRIC_PREFIX = "voicecapture.recording";

    private final MeterRegistry registry;

    public RecordingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics recorder backed by a private in-memory registry, for wiring without Spring.
     */
    public static RecordingMetrics inMemory() {
        return new RecordingMetrics(new SimpleMeterRegistry());
    }

    public void recordingStarted() {
        Counter.builder(METRIC_PREFIX + ".started")
                .description("Number of recordings started")
                .register(registry)
                .increment();
    }

    /**
     * Records a session that produced a transcribed file.
     *
     * @param durationMs encoded audio duration
     * @param fileSizeBytes WAV file size, header included
     */
    public void recordingCompleted(long durationMs, long fileSizeBytes) {
        Counter.builder(METRIC_PREFIX + ".completed")
                .description("Number of recordings transcribed successfully")
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Duration of completed recordings")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        DistributionSummary.builder(METRIC_PREFIX + ".file.size")
                .description("Size of completed recordings")
                .baseUnit("bytes")
                .register(registry)
                .record(fileSizeBytes);
    }

    /**
     * Increments the failure counter.
     *
     * @param kind failure kind (PERMISSION_DENIED, TIMEOUT, TRANSCRIPTION, ...)
     */
    public void recordingFailed(String kind) {
        Counter.builder(METRIC_PREFIX + ".failed")
                .description("Number of recordings ending in the error state")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void sizeLimitReached() {
        Counter.builder("voicecapture.capture.size_limit")
                .description("Number of captures stopped by the file size limit")
                .register(registry)
                .increment();
    }

    /**
     * Records transcription request latency.
     *
     * @param durationNanos duration in nanoseconds
     * @param success whether the request produced a result
     */
    public void recordTranscriptionLatency(long durationNanos, boolean success) {
        Timer.builder("voicecapture.transcription.latency")
                .description("Time taken by the transcription client")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
