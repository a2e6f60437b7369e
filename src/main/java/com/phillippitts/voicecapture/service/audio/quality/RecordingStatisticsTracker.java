package com.phillippitts.voicecapture.service.audio.quality;

import com.phillippitts.voicecapture.domain.RecordingConstraints;
import com.phillippitts.voicecapture.service.audio.WavWriter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates per-buffer metrics for one capture session.
 *
 * <p>Written by the capture thread and read by callers polling live statistics, so every
 * method is synchronized. Only the most recent {@value #HISTORY_SIZE} metrics are kept for
 * averages; counters cover the whole session.
 */
public class RecordingStatisticsTracker {

    static final int HISTORY_SIZE = 100;

    private static final double TOO_QUIET_RMS = 0.05;
    private static final double TOO_MUCH_SILENCE_PERCENT = 50.0;
    private static final double HIGH_NOISE_FLOOR_DB = -30.0;
    private static final int POOR_QUALITY_SCORE = 30;
    private static final int DEFAULT_QUALITY = 50;

    private final RecordingConstraints constraints;
    private final Deque<AudioMetrics> history = new ArrayDeque<>();

    private long totalSamples;
    private long silentSamples;
    private int clippingEvents;
    private double peakSoFar;

    public RecordingStatisticsTracker(RecordingConstraints constraints) {
        this.constraints = Objects.requireNonNull(constraints, "constraints must not be null");
    }

    /**
     * Records the metrics of one buffer.
     *
     * @param metrics metrics of the buffer
     * @param samples number of samples in the buffer
     */
    public synchronized void update(AudioMetrics metrics, int samples) {
        Objects.requireNonNull(metrics, "metrics must not be null");
        totalSamples += samples;
        if (metrics.silent()) {
            silentSamples += samples;
        }
        if (metrics.clipping()) {
            clippingEvents++;
        }
        peakSoFar = Math.max(peakSoFar, metrics.peakLevel());
        history.addLast(metrics);
        if (history.size() > HISTORY_SIZE) {
            history.removeFirst();
        }
    }

    /** Duration of the audio seen so far. */
    public synchronized long capturedDurationMs() {
        return totalSamples * 1000L / constraints.sampleRate();
    }

    /** Size the encoded WAV would have with the samples seen so far. */
    public synchronized long currentFileSizeBytes() {
        return WavWriter.fileSizeFor(totalSamples);
    }

    /** True once the encoded size reaches the force-stop fraction of the upload limit. */
    public synchronized boolean isSizeLimitReached() {
        return currentFileSizeBytes() >= constraints.sizeLimitStopBytes();
    }

    public synchronized RecordingStatistics statistics(long durationMs) {
        long fileSize = currentFileSizeBytes();
        long maxSize = constraints.maxFileSizeBytes();
        double bytesPerMs = durationMs > constraints.minRecordingDurationMs()
                ? (double) fileSize / durationMs
                : 0.0;

        long estimatedFinal;
        long remaining;
        if (bytesPerMs > 0.0) {
            estimatedFinal = Math.min((long) (bytesPerMs * constraints.maxRecordingDurationMs()), maxSize);
            remaining = Math.max(0L, (long) ((maxSize - fileSize) / bytesPerMs));
        } else {
            estimatedFinal = fileSize;
            remaining = Math.max(0L, constraints.maxRecordingDurationMs() - durationMs);
        }

        return new RecordingStatistics(durationMs, fileSize, estimatedFinal, remaining,
                averageRms(), peakSoFar, silencePercentage(), clippingEvents, overallQuality());
    }

    /**
     * Builds the end-of-session report.
     *
     * @param durationMs final capture duration
     */
    public synchronized QualityReport qualityReport(long durationMs) {
        RecordingStatistics stats = statistics(durationMs);
        AudioMetrics average = averageMetrics();

        List<QualityIssue> issues = new ArrayList<>();
        if (clippingEvents > 0) {
            issues.add(QualityIssue.CLIPPING);
        }
        if (!history.isEmpty() && average.rmsLevel() < TOO_QUIET_RMS) {
            issues.add(QualityIssue.TOO_QUIET);
        }
        if (stats.silencePercentage() > TOO_MUCH_SILENCE_PERCENT) {
            issues.add(QualityIssue.TOO_MUCH_SILENCE);
        }
        if (average.noiseFloor() > HIGH_NOISE_FLOOR_DB) {
            issues.add(QualityIssue.HIGH_NOISE);
        }
        if (stats.overallQuality() < POOR_QUALITY_SCORE) {
            issues.add(QualityIssue.POOR_QUALITY);
        }

        List<String> recommendations = new ArrayList<>(issues.size());
        for (QualityIssue issue : issues) {
            recommendations.add(issue.recommendation());
        }
        return new QualityReport(stats.overallQuality(), average, stats, issues, recommendations);
    }

    public synchronized void reset() {
        history.clear();
        totalSamples = 0L;
        silentSamples = 0L;
        clippingEvents = 0;
        peakSoFar = 0.0;
    }

    private double silencePercentage() {
        return totalSamples == 0 ? 0.0 : silentSamples * 100.0 / totalSamples;
    }

    private double averageRms() {
        return history.stream().mapToDouble(AudioMetrics::rmsLevel).average().orElse(0.0);
    }

    private int overallQuality() {
        if (history.isEmpty()) {
            return DEFAULT_QUALITY;
        }
        return (int) Math.round(history.stream().mapToInt(AudioMetrics::qualityScore).average().orElse(0.0));
    }

    private AudioMetrics averageMetrics() {
        if (history.isEmpty()) {
            return AudioMetrics.empty(constraints.noiseFloorDb());
        }
        double rms = averageRms();
        double peak = history.stream().mapToDouble(AudioMetrics::peakLevel).average().orElse(0.0);
        double db = history.stream().mapToDouble(AudioMetrics::dbLevel).average().orElse(0.0);
        double noise = history.stream().mapToDouble(AudioMetrics::noiseFloor).average().orElse(0.0);
        double snr = history.stream().mapToDouble(AudioMetrics::signalToNoise).average().orElse(0.0);
        return new AudioMetrics(rms, peak, db, clippingEvents > 0,
                silencePercentage() > TOO_MUCH_SILENCE_PERCENT, noise, snr, overallQuality());
    }
}
