package com.phillippitts.voicecapture.service.audio.quality;

import java.util.List;
import java.util.Objects;

/**
 * End-of-session quality summary.
 *
 * @param overallQuality  mean quality score, 0-100
 * @param averageMetrics  metrics averaged over the session's recent buffers
 * @param statistics      final session statistics
 * @param issues          detected problems, in a stable order
 * @param recommendations one recommendation per issue
 */
public record QualityReport(
        int overallQuality,
        AudioMetrics averageMetrics,
        RecordingStatistics statistics,
        List<QualityIssue> issues,
        List<String> recommendations
) {

    public QualityReport {
        Objects.requireNonNull(averageMetrics, "averageMetrics must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
