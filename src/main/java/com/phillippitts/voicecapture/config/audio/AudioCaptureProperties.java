package com.phillippitts.voicecapture.config.audio;

import com.phillippitts.voicecapture.domain.QualityPreset;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by service): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Duration of one read from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(500)
    private final int bufferMillis;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    /** DSP stages applied to a finished recording. */
    @NotNull
    private final QualityPreset qualityPreset;

    /** Upload limit of the transcription service, WAV header included. Samples are buffered in memory. */
    @Min(1_024)
    @Max(Integer.MAX_VALUE)
    private final long maxFileSizeBytes;

    /** Buffers quieter than this are silent. */
    @DecimalMin("-120.0")
    @DecimalMax("0.0")
    private final double silenceThresholdDb;

    /** Continuous silence needed before the detector reports silence. */
    @Min(100)
    private final long silenceDurationMs;

    /** Normalized amplitude at or above which a sample counts as clipped. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private final double clippingThreshold;

    /** Recordings shorter than this report no rate-based statistics. */
    @Min(0)
    private final long minRecordingDurationMs;

    @ConstructorBinding
    public AudioCaptureProperties(@DefaultValue("100") int bufferMillis,
                                  String deviceName,
                                  @DefaultValue("MEDIUM") QualityPreset qualityPreset,
                                  @DefaultValue("26214400") long maxFileSizeBytes,
                                  @DefaultValue("-40.0") double silenceThresholdDb,
                                  @DefaultValue("2000") long silenceDurationMs,
                                  @DefaultValue("0.99") double clippingThreshold,
                                  @DefaultValue("100") long minRecordingDurationMs) {
        this.bufferMillis = bufferMillis;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
        this.qualityPreset = qualityPreset;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.silenceThresholdDb = silenceThresholdDb;
        this.silenceDurationMs = silenceDurationMs;
        this.clippingThreshold = clippingThreshold;
        this.minRecordingDurationMs = minRecordingDurationMs;
    }

    public int getBufferMillis() { return bufferMillis; }
    public String getDeviceName() { return deviceName; }
    public QualityPreset getQualityPreset() { return qualityPreset; }
    public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
    public double getSilenceThresholdDb() { return silenceThresholdDb; }
    public long getSilenceDurationMs() { return silenceDurationMs; }
    public double getClippingThreshold() { return clippingThreshold; }
    public long getMinRecordingDurationMs() { return minRecordingDurationMs; }
}
