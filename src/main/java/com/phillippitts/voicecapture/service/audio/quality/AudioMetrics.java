package com.phillippitts.voicecapture.service.audio.quality;

/**
 * Quality measurements for one capture buffer.
 *
 * @param rmsLevel       root-mean-square amplitude, normalized to [0, 1]
 * @param peakLevel      largest absolute amplitude, normalized to [0, 1]
 * @param dbLevel        {@code 20·log10(rmsLevel)}, or {@value AudioQualityAnalyzer#SILENCE_FLOOR_DB} for pure silence
 * @param clipping       whether more than 1% of samples reached the clipping threshold
 * @param silent         whether {@code dbLevel} is below the silence threshold
 * @param noiseFloor     level of the 10th-percentile absolute amplitude, in dB
 * @param signalToNoise  {@code dbLevel - noiseFloor} when positive, otherwise 0
 * @param qualityScore   heuristic score in [0, 100]
 */
public record AudioMetrics(
        double rmsLevel,
        double peakLevel,
        double dbLevel,
        boolean clipping,
        boolean silent,
        double noiseFloor,
        double signalToNoise,
        int qualityScore
) {

    /** Metrics for an empty buffer. */
    public static AudioMetrics empty(double noiseFloorDb) {
        return new AudioMetrics(0.0, 0.0, AudioQualityAnalyzer.SILENCE_FLOOR_DB, false, true,
                noiseFloorDb, 0.0, 0);
    }
}
