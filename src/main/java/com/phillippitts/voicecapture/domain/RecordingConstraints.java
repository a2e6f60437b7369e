package com.phillippitts.voicecapture.domain;

/**
 * Immutable limits and thresholds for a recording session.
 *
 * <p>Built once at startup from configuration and shared read-only by the capture engine,
 * the quality analyzer and the orchestrator. The byte limit comes from the transcription
 * API upload limit; the maximum duration is derived from it.
 *
 * @param maxFileSizeBytes        upload limit for the WAV file, header included
 * @param sampleRate              capture sample rate in Hz
 * @param bitsPerSample           sample width
 * @param channels                channel count
 * @param silenceThresholdDb      level below which a buffer counts as silent
 * @param silenceDurationMs       continuous silence needed to enter the silent state
 * @param clippingThreshold       normalized amplitude at or above which a sample is clipped
 * @param noiseFloorDb            noise floor reported when it cannot be estimated
 * @param bufferDurationMs        duration of one capture read
 * @param minRecordingDurationMs  shortest recording worth analyzing for statistics
 */
public record RecordingConstraints(
        long maxFileSizeBytes,
        int sampleRate,
        int bitsPerSample,
        int channels,
        double silenceThresholdDb,
        long silenceDurationMs,
        double clippingThreshold,
        double noiseFloorDb,
        int bufferDurationMs,
        long minRecordingDurationMs
) {

    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 25L * 1024 * 1024;

    /** Noise floor reported when it cannot be estimated from the signal. */
    public static final double DEFAULT_NOISE_FLOOR_DB = -50.0;

    /** Fraction of the size limit at which capture stops so the final file still fits. */
    public static final double SIZE_LIMIT_STOP_RATIO = 0.95;

    public RecordingConstraints {
        if (maxFileSizeBytes <= 0 || maxFileSizeBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxFileSizeBytes must be in (0, 2 GiB), got: " + maxFileSizeBytes);
        }
        if (sampleRate <= 0 || bitsPerSample <= 0 || channels <= 0) {
            throw new IllegalArgumentException("sampleRate, bitsPerSample and channels must be > 0");
        }
        if (bufferDurationMs <= 0) {
            throw new IllegalArgumentException("bufferDurationMs must be > 0, got: " + bufferDurationMs);
        }
        if (clippingThreshold <= 0.0 || clippingThreshold > 1.0) {
            throw new IllegalArgumentException("clippingThreshold must be in (0, 1], got: " + clippingThreshold);
        }
    }

    /** Defaults matching a 25 MiB upload limit at 16 kHz, 16-bit, mono. */
    public static RecordingConstraints defaults() {
        return new RecordingConstraints(DEFAULT_MAX_FILE_SIZE_BYTES, 16_000, 16, 1,
                -40.0, 2_000L, 0.99, DEFAULT_NOISE_FLOOR_DB, 100, 100L);
    }

    /** Returns a copy with a different size limit. */
    public RecordingConstraints withMaxFileSizeBytes(long bytes) {
        return new RecordingConstraints(bytes, sampleRate, bitsPerSample, channels, silenceThresholdDb,
                silenceDurationMs, clippingThreshold, noiseFloorDb, bufferDurationMs, minRecordingDurationMs);
    }

    public int bytesPerSecond() {
        return sampleRate * channels * bitsPerSample / 8;
    }

    /** Longest recording whose encoded size fits the upload limit. */
    public long maxRecordingDurationMs() {
        return maxFileSizeBytes * 1000L / bytesPerSecond();
    }

    /** File size at which capture force-stops. */
    public long sizeLimitStopBytes() {
        return (long) (maxFileSizeBytes * SIZE_LIMIT_STOP_RATIO);
    }

    /** Number of samples read per capture buffer. */
    public int samplesPerBuffer() {
        return sampleRate * channels * bufferDurationMs / 1000;
    }
}
