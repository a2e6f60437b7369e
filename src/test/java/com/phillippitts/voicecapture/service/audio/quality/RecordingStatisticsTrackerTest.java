package com.phillippitts.voicecapture.service.audio.quality;

import com.phillippitts.voicecapture.domain.RecordingConstraints;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RecordingStatisticsTrackerTest {

    private final RecordingConstraints constraints = RecordingConstraints.defaults();
    private final AudioQualityAnalyzer analyzer = new AudioQualityAnalyzer(constraints);

    @Test
    void accumulatesSizeSilenceAndPeak() {
        RecordingStatisticsTracker tracker = new RecordingStatisticsTracker(constraints);
        short[] tone = AudioQualityAnalyzerTest.sine(1_600, 440, 0.3);

        tracker.update(analyzer.analyze(tone), tone.length);
        tracker.update(analyzer.analyze(new short[1_600]), 1_600);

        RecordingStatistics stats = tracker.statistics(200);
        assertThat(stats.fileSizeBytes()).isEqualTo(44 + 3_200 * 2);
        assertThat(stats.silencePercentage()).isCloseTo(50.0, within(0.001));
        assertThat(stats.peakLevel()).isCloseTo(0.3, within(0.01));
        assertThat(stats.clippingOccurrences()).isZero();
        assertThat(stats.remainingTimeMs()).isPositive();
        assertThat(stats.estimatedFinalSizeBytes()).isLessThanOrEqualTo(constraints.maxFileSizeBytes());
    }

    @Test
    void shortSessionsFallBackToDurationBudget() {
        RecordingStatisticsTracker tracker = new RecordingStatisticsTracker(constraints);

        RecordingStatistics stats = tracker.statistics(50);

        assertThat(stats.remainingTimeMs()).isEqualTo(constraints.maxRecordingDurationMs() - 50);
        assertThat(stats.overallQuality()).isEqualTo(50);
    }

    @Test
    void sizeLimitReachedAtNinetyFivePercent() {
        RecordingConstraints small = constraints.withMaxFileSizeBytes(10_044);
        RecordingStatisticsTracker tracker = new RecordingStatisticsTracker(small);
        AudioMetrics quiet = analyzer.analyze(new short[1_000]);

        tracker.update(quiet, 4_700);
        assertThat(tracker.isSizeLimitReached()).isFalse();

        tracker.update(quiet, 50);
        assertThat(tracker.currentFileSizeBytes()).isEqualTo(44 + 4_750 * 2);
        assertThat(tracker.isSizeLimitReached()).isTrue();
    }

    @Test
    void reportFlagsSilenceAndQuietness() {
        RecordingStatisticsTracker tracker = new RecordingStatisticsTracker(constraints);
        for (int i = 0; i < 10; i++) {
            tracker.update(analyzer.analyze(new short[1_600]), 1_600);
        }

        QualityReport report = tracker.qualityReport(1_000);

        assertThat(report.issues()).contains(QualityIssue.TOO_QUIET, QualityIssue.TOO_MUCH_SILENCE);
        assertThat(report.issues()).doesNotContain(QualityIssue.CLIPPING, QualityIssue.HIGH_NOISE);
        assertThat(report.recommendations()).hasSameSizeAs(report.issues());
        assertThat(report.averageMetrics().silent()).isTrue();
    }

    @Test
    void reportFlagsClipping() {
        RecordingStatisticsTracker tracker = new RecordingStatisticsTracker(constraints);
        short[] clipped = new short[1_600];
        java.util.Arrays.fill(clipped, Short.MAX_VALUE);

        tracker.update(analyzer.analyze(clipped), clipped.length);

        assertThat(tracker.qualityReport(100).issues()).contains(QualityIssue.CLIPPING);
    }

    @Test
    void historyIsBounded() {
        RecordingStatisticsTracker tracker = new RecordingStatisticsTracker(constraints);
        AudioMetrics loud = analyzer.analyze(AudioQualityAnalyzerTest.sine(1_600, 440, 0.3));
        AudioMetrics silent = analyzer.analyze(new short[1_600]);

        tracker.update(silent, 1_600);
        for (int i = 0; i < RecordingStatisticsTracker.HISTORY_SIZE; i++) {
            tracker.update(loud, 1_600);
        }

        // The silent buffer has dropped out of the average but still counts toward silence
        assertThat(tracker.statistics(10_100).overallQuality()).isEqualTo(loud.qualityScore());
        assertThat(tracker.statistics(10_100).silencePercentage()).isGreaterThan(0.0);
    }
}
