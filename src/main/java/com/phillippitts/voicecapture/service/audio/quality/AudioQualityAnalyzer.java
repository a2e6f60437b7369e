package com.phillippitts.voicecapture.service.audio.quality;

import com.phillippitts.voicecapture.domain.RecordingConstraints;

import java.util.Arrays;
import java.util.Objects;

import static com.phillippitts.voicecapture.service.audio.AudioFormat.FULL_SCALE;

/**
 * Computes {@link AudioMetrics} for a PCM16 buffer.
 *
 * <p>Stateless and side-effect free; one instance is shared by every capture session.
 *
 * <p><b>Quality score</b> starts at 50 and is adjusted:
 * <ul>
 *   <li>-30 when clipping</li>
 *   <li>-20 when silent</li>
 *   <li>+0.75 per dB of signal-to-noise ratio, capped at 40 dB</li>
 *   <li>+20 when RMS is in [0.1, 0.5], otherwise -10 when RMS is below 0.05</li>
 *   <li>+10 when the peak stays below 0.9</li>
 * </ul>
 * The result is clamped to [0, 100].
 *
 * @since 1.0
 */
public class AudioQualityAnalyzer {

    /** Level reported for a buffer whose RMS is exactly zero. */
    public static final double SILENCE_FLOOR_DB = -100.0;

    /** Fraction of clipped samples above which the buffer is flagged. */
    static final double CLIPPING_RATIO = 0.01;

    /** Buffers shorter than this report the configured noise floor. */
    static final int MIN_SAMPLES_FOR_NOISE_FLOOR = 100;

    private static final int BASE_SCORE = 50;
    private static final int CLIPPING_PENALTY = 30;
    private static final int SILENCE_PENALTY = 20;
    private static final double MAX_SNR_DB = 40.0;
    private static final double SNR_WEIGHT = 0.75;

    private final RecordingConstraints constraints;

    public AudioQualityAnalyzer(RecordingConstraints constraints) {
        this.constraints = Objects.requireNonNull(constraints, "constraints must not be null");
    }

    /** Analyzes the whole buffer. */
    public AudioMetrics analyze(short[] buffer) {
        return analyze(buffer, buffer == null ? 0 : buffer.length);
    }

    /**
     * Analyzes the first {@code length} samples of the buffer.
     *
     * @param buffer PCM16 samples
     * @param length number of valid samples
     * @return metrics; {@link AudioMetrics#empty(double)} when there are no samples
     */
    public AudioMetrics analyze(short[] buffer, int length) {
        int n = buffer == null ? 0 : Math.min(length, buffer.length);
        if (n <= 0) {
            return AudioMetrics.empty(constraints.noiseFloorDb());
        }

        double sumSquares = 0.0;
        double peak = 0.0;
        int clipped = 0;
        for (int i = 0; i < n; i++) {
            double amplitude = Math.abs(buffer[i] / FULL_SCALE);
            sumSquares += amplitude * amplitude;
            if (amplitude > peak) {
                peak = amplitude;
            }
            if (amplitude >= constraints.clippingThreshold()) {
                clipped++;
            }
        }

        double rms = Math.sqrt(sumSquares / n);
        double db = toDb(rms);
        boolean clipping = clipped > n * CLIPPING_RATIO;
        boolean silent = db < constraints.silenceThresholdDb();
        double noiseFloor = noiseFloor(buffer, n);
        double snr = noiseFloor < db ? db - noiseFloor : 0.0;

        int score = score(rms, peak, clipping, silent, snr);
        return new AudioMetrics(rms, peak, db, clipping, silent, noiseFloor, snr, score);
    }

    private double noiseFloor(short[] buffer, int n) {
        if (n < MIN_SAMPLES_FOR_NOISE_FLOOR) {
            return constraints.noiseFloorDb();
        }
        double[] sorted = new double[n];
        for (int i = 0; i < n; i++) {
            sorted[i] = Math.abs(buffer[i] / FULL_SCALE);
        }
        Arrays.sort(sorted);
        double p10 = sorted[n / 10];
        return p10 > 0.0 ? 20.0 * Math.log10(p10) : constraints.noiseFloorDb();
    }

    private static int score(double rms, double peak, boolean clipping, boolean silent, double snr) {
        int score = BASE_SCORE;
        if (clipping) {
            score -= CLIPPING_PENALTY;
        }
        if (silent) {
            score -= SILENCE_PENALTY;
        }
        score += (int) (Math.max(0.0, Math.min(snr, MAX_SNR_DB)) * SNR_WEIGHT);
        if (rms >= 0.1 && rms <= 0.5) {
            score += 20;
        } else if (rms < 0.05) {
            score -= 10;
        }
        if (peak < 0.9) {
            score += 10;
        }
        return Math.max(0, Math.min(100, score));
    }

    static double toDb(double rms) {
        return rms > 0.0 ? 20.0 * Math.log10(rms) : SILENCE_FLOOR_DB;
    }
}
