package com.phillippitts.voicecapture.config.recording;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Default transcription request settings, used by the properties-backed settings provider.
 */
@Validated
@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties {

    @NotBlank
    private final String model;

    @NotBlank
    private final String language;

    private final String prompt;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double temperature;

    @ConstructorBinding
    public TranscriptionProperties(@DefaultValue("whisper-1") String model,
                                   @DefaultValue("en") String language,
                                   String prompt,
                                   @DefaultValue("0.0") double temperature) {
        this.model = model;
        this.language = language;
        this.prompt = prompt == null ? "" : prompt;
        this.temperature = temperature;
    }

    public String getModel() { return model; }
    public String getLanguage() { return language; }
    public String getPrompt() { return prompt; }
    public double getTemperature() { return temperature; }
}
