package com.phillippitts.voicecapture.service.transcription;

import com.phillippitts.voicecapture.config.recording.TranscriptionProperties;
import com.phillippitts.voicecapture.domain.TranscriptionSettings;

import java.util.Objects;

/**
 * {@link SettingsProvider} backed by the {@code transcription.*} properties.
 */
public class PropertiesSettingsProvider implements SettingsProvider {

    private final TranscriptionProperties props;

    public PropertiesSettingsProvider(TranscriptionProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public TranscriptionSettings currentSettings() {
        return new TranscriptionSettings(props.getLanguage(), props.getModel(),
                props.getPrompt(), props.getTemperature());
    }
}
