package com.phillippitts.voicecapture.service.audio.quality;

/**
 * Snapshot of a capture session's running statistics.
 *
 * @param durationMs              elapsed capture time
 * @param fileSizeBytes           size the WAV file would have if encoded now, header included
 * @param estimatedFinalSizeBytes projected size at the maximum recording duration, capped at the limit
 * @param remainingTimeMs         time left before the size limit is reached at the current rate
 * @param averageLevel            mean RMS over recent buffers
 * @param peakLevel               largest normalized amplitude seen so far
 * @param silencePercentage       share of samples in silent buffers, 0-100
 * @param clippingOccurrences     number of buffers flagged as clipping
 * @param overallQuality          mean quality score over recent buffers
 */
public record RecordingStatistics(
        long durationMs,
        long fileSizeBytes,
        long estimatedFinalSizeBytes,
        long remainingTimeMs,
        double averageLevel,
        double peakLevel,
        double silencePercentage,
        int clippingOccurrences,
        int overallQuality
) {

    public static RecordingStatistics empty() {
        return new RecordingStatistics(0L, 0L, 0L, 0L, 0.0, 0.0, 0.0, 0, 0);
    }
}
