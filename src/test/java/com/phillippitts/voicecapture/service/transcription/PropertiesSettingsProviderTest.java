package com.phillippitts.voicecapture.service.transcription;

import com.phillippitts.voicecapture.config.recording.TranscriptionProperties;
import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.TranscriptionSettings;
import com.phillippitts.voicecapture.exception.TranscriptionException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertiesSettingsProviderTest {

    @Test
    void shouldSnapshotConfiguredSettings() {
        TranscriptionProperties props = new TranscriptionProperties("whisper-1", "de", "Glossary: Kubernetes", 0.2);

        TranscriptionSettings settings = new PropertiesSettingsProvider(props).currentSettings();

        assertThat(settings.language()).isEqualTo("de");
        assertThat(settings.model()).isEqualTo("whisper-1");
        assertThat(settings.customPrompt()).isEqualTo("Glossary: Kubernetes");
        assertThat(settings.temperature()).isEqualTo(0.2);
        assertThat(settings.hasCustomPrompt()).isTrue();
    }

    @Test
    void shouldTreatMissingPromptAsEmpty() {
        TranscriptionProperties props = new TranscriptionProperties("whisper-1", "en", null, 0.0);

        TranscriptionSettings settings = new PropertiesSettingsProvider(props).currentSettings();

        assertThat(settings.customPrompt()).isEmpty();
        assertThat(settings.hasCustomPrompt()).isFalse();
    }

    @Test
    void unconfiguredClientFailsWithModelInMessage() {
        UnconfiguredTranscriptionClient client = new UnconfiguredTranscriptionClient();
        AudioFile audio = new AudioFile(Path.of("/tmp/a.wav"), 1_000, 32_044, "s-1");

        assertThatThrownBy(() -> client.transcribe(audio, new TranscriptionSettings("en", "whisper-1", "", 0.0)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("No transcription client configured")
                .hasMessageContaining("whisper-1");
    }
}
