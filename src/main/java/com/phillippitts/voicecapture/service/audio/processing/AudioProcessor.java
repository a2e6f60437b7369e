package com.phillippitts.voicecapture.service.audio.processing;

import com.phillippitts.voicecapture.domain.QualityPreset;
import com.phillippitts.voicecapture.domain.RecordingConstraints;

import java.util.Arrays;
import java.util.Objects;

import static com.phillippitts.voicecapture.service.audio.AudioFormat.FULL_SCALE;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.MAX_SAMPLE_VALUE;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Signal conditioning applied to a finished recording before it is encoded.
 *
 * <p>Stages, in order, each enabled by the {@link QualityPreset}:
 * <ol>
 *   <li>Silence trim: drop leading and trailing samples below 1% of full scale,
 *       keeping a 100-sample guard band</li>
 *   <li>Noise gate: attenuate samples whose ±50-sample neighbourhood is below 0.5% of full scale</li>
 *   <li>Normalize: scale so the peak reaches 90% of full scale</li>
 *   <li>High-pass: single-pole filter removing rumble below the cutoff (80 Hz by default)</li>
 * </ol>
 *
 * <p>Every stage is total: it never throws and returns an empty array for empty input.
 * Only trimming changes the length.
 *
 * @since 1.0
 */
public class AudioProcessor {

    static final int TRIM_THRESHOLD = (int) (FULL_SCALE * 0.01);
    static final int TRIM_GUARD_SAMPLES = 100;
    static final int GATE_THRESHOLD = (int) (FULL_SCALE * 0.005);
    static final int GATE_WINDOW = 50;
    static final double GATE_ATTENUATION = 0.1;
    static final int NORMALIZE_TARGET = (int) (MAX_SAMPLE_VALUE * 0.9);
    static final int NORMALIZE_SKIP_PEAK = 16_384;
    static final double DEFAULT_HIGH_PASS_CUTOFF_HZ = 80.0;

    private final QualityPreset preset;

    public AudioProcessor(QualityPreset preset) {
        this.preset = Objects.requireNonNull(preset, "preset must not be null");
    }

    public QualityPreset preset() {
        return preset;
    }

    /**
     * Runs the preset's stages over the samples.
     *
     * @param samples captured samples; not modified
     * @return processed copy
     */
    public short[] process(short[] samples) {
        if (samples == null || samples.length == 0) {
            return new short[0];
        }
        short[] out = samples;
        if (preset.silenceTrimming()) {
            out = trimSilence(out);
        }
        if (preset.noiseReduction()) {
            out = applyNoiseGate(out);
        }
        if (preset.normalization()) {
            out = normalize(out);
        }
        if (preset.highPassFilter()) {
            out = highPass(out, DEFAULT_HIGH_PASS_CUTOFF_HZ, REQUIRED_SAMPLE_RATE);
        }
        return out == samples ? samples.clone() : out;
    }

    /**
     * Removes leading and trailing quiet samples. Input with no sample above the
     * threshold is returned unchanged.
     */
    public static short[] trimSilence(short[] samples) {
        if (samples == null || samples.length == 0) {
            return new short[0];
        }
        int first = -1;
        int last = -1;
        for (int i = 0; i < samples.length; i++) {
            if (Math.abs(samples[i]) > TRIM_THRESHOLD) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        if (first < 0) {
            return samples;
        }
        int start = Math.max(0, first - TRIM_GUARD_SAMPLES);
        int end = Math.min(samples.length - 1, last + TRIM_GUARD_SAMPLES);
        if (start >= end) {
            return samples;
        }
        return Arrays.copyOfRange(samples, start, end + 1);
    }

    /** Attenuates samples in low-energy neighbourhoods to 10% of their value. */
    public static short[] applyNoiseGate(short[] samples) {
        if (samples == null || samples.length == 0) {
            return new short[0];
        }
        int n = samples.length;
        // Prefix sums of squares give each window's energy in O(1).
        double[] prefix = new double[n + 1];
        for (int i = 0; i < n; i++) {
            double s = samples[i] / FULL_SCALE;
            prefix[i + 1] = prefix[i] + s * s;
        }
        short[] out = new short[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - GATE_WINDOW);
            int to = Math.min(n, i + GATE_WINDOW + 1);
            double windowRms = Math.sqrt((prefix[to] - prefix[from]) / (to - from));
            if (windowRms * FULL_SCALE > GATE_THRESHOLD) {
                out[i] = samples[i];
            } else {
                out[i] = (short) (int) (samples[i] * GATE_ATTENUATION);
            }
        }
        return out;
    }

    /**
     * Scales samples so the peak reaches 90% of full scale. Quiet-but-not-silent input
     * whose peak already exceeds half scale is left alone, as is digital silence.
     */
    public static short[] normalize(short[] samples) {
        if (samples == null || samples.length == 0) {
            return new short[0];
        }
        int peak = 0;
        for (short s : samples) {
            peak = Math.max(peak, Math.abs((int) s));
        }
        if (peak == 0) {
            return samples.clone();
        }
        double factor = (double) NORMALIZE_TARGET / peak;
        if (factor > 1.0 && peak > NORMALIZE_SKIP_PEAK) {
            return samples.clone();
        }
        short[] out = new short[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = clamp(Math.round(samples[i] * factor));
        }
        return out;
    }

    /**
     * Single-pole high-pass filter.
     *
     * @param samples    input samples
     * @param cutoffHz   cutoff frequency
     * @param sampleRate sample rate in Hz
     */
    public static short[] highPass(short[] samples, double cutoffHz, int sampleRate) {
        if (samples == null || samples.length == 0) {
            return new short[0];
        }
        double rc = 1.0 / (2.0 * Math.PI * cutoffHz);
        double dt = 1.0 / sampleRate;
        double alpha = rc / (rc + dt);

        short[] out = new short[samples.length];
        double prevX = samples[0];
        double prevY = samples[0];
        out[0] = samples[0];
        for (int i = 1; i < samples.length; i++) {
            double x = samples[i];
            double y = alpha * (prevY + x - prevX);
            out[i] = clamp(Math.round(y));
            prevX = x;
            prevY = y;
        }
        return out;
    }

    /**
     * Level of the 10th-percentile absolute amplitude in dB, or
     * {@link RecordingConstraints#DEFAULT_NOISE_FLOOR_DB} for empty or silent input.
     */
    public static double detectNoiseLevel(short[] samples) {
        if (samples == null || samples.length == 0) {
            return RecordingConstraints.DEFAULT_NOISE_FLOOR_DB;
        }
        int[] sorted = sortedAbs(samples);
        int p10 = sorted[sorted.length / 10];
        return p10 > 0 ? 20.0 * Math.log10(p10 / FULL_SCALE) : RecordingConstraints.DEFAULT_NOISE_FLOOR_DB;
    }

    /**
     * Ratio in dB between the 90th and 10th percentile of non-zero amplitudes;
     * 0 when there are no non-zero samples.
     */
    public static double calculateDynamicRange(short[] samples) {
        if (samples == null || samples.length == 0) {
            return 0.0;
        }
        int[] nonZero = Arrays.stream(sortedAbs(samples)).filter(v -> v > 0).toArray();
        if (nonZero.length == 0) {
            return 0.0;
        }
        int p90 = nonZero[Math.min(nonZero.length - 1, (int) (nonZero.length * 0.9))];
        int p10 = nonZero[(int) (nonZero.length * 0.1)];
        return 20.0 * Math.log10((double) p90 / p10);
    }

    private static int[] sortedAbs(short[] samples) {
        int[] abs = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            abs[i] = Math.abs((int) samples[i]);
        }
        Arrays.sort(abs);
        return abs;
    }

    private static short clamp(long v) {
        if (v > Short.MAX_VALUE) {
            return Short.MAX_VALUE;
        }
        if (v < Short.MIN_VALUE) {
            return Short.MIN_VALUE;
        }
        return (short) v;
    }
}
