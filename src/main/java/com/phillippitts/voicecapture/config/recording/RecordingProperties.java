package com.phillippitts.voicecapture.config.recording;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the recording lifecycle.
 */
@Validated
@ConfigurationProperties(prefix = "recording")
public class RecordingProperties {

    /** Directory receiving finished WAV files; defaults to {@code voice-capture} under the temp dir. */
    private final String outputDir;

    /** How long the Success state is shown before returning to Idle. */
    @Min(0)
    private final long successDisplayDelayMs;

    /** Interval between live duration updates while recording. */
    @Min(10)
    private final long durationTickMs;

    /** Delay between processing progress steps. */
    @Min(0)
    private final long progressStepDelayMs;

    @ConstructorBinding
    public RecordingProperties(String outputDir,
                               @DefaultValue("1500") long successDisplayDelayMs,
                               @DefaultValue("100") long durationTickMs,
                               @DefaultValue("50") long progressStepDelayMs) {
        this.outputDir = (outputDir == null || outputDir.isBlank())
                ? Path.of(System.getProperty("java.io.tmpdir"), "voice-capture").toString()
                : outputDir;
        this.successDisplayDelayMs = successDisplayDelayMs;
        this.durationTickMs = durationTickMs;
        this.progressStepDelayMs = progressStepDelayMs;
    }

    public String getOutputDir() { return outputDir; }
    public long getSuccessDisplayDelayMs() { return successDisplayDelayMs; }
    public long getDurationTickMs() { return durationTickMs; }
    public long getProgressStepDelayMs() { return progressStepDelayMs; }
}
