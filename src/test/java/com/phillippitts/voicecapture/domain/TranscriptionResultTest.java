package com.phillippitts.voicecapture.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionResultTest {

    @Test
    void shouldCreateValidTranscriptionResult() {
        TranscriptionResult result = new TranscriptionResult("hello world", "en", 2.5);

        assertThat(result.text()).isEqualTo("hello world");
        assertThat(result.detectedLanguage()).contains("en");
        assertThat(result.reportedDuration()).contains(2.5);
    }

    @Test
    void shouldRejectNullText() {
        assertThatThrownBy(() -> new TranscriptionResult(null, "en", 1.0))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("text must not be null");
    }

    @Test
    void shouldAcceptEmptyTextAndMissingMetadata() {
        // Silence may produce an empty transcription
        TranscriptionResult result = TranscriptionResult.of("");

        assertThat(result.text()).isEmpty();
        assertThat(result.detectedLanguage()).isEmpty();
        assertThat(result.reportedDuration()).isEmpty();
    }

    @Test
    void shouldRejectNegativeDuration() {
        assertThatThrownBy(() -> new TranscriptionResult("text", null, -1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duration");
    }
}
