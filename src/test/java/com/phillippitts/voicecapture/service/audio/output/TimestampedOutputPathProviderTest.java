package com.phillippitts.voicecapture.service.audio.output;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampedOutputPathProviderTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @Test
    void shouldNameFileWithTimestampAndShortSessionId() {
        TimestampedOutputPathProvider provider = new TimestampedOutputPathProvider(Path.of("/tmp/rec"), FIXED);

        Path path = provider.newOutputPath("3f2a9c1e-77b0-4d2e-9a0c-5b7e1d2f3a4b");

        assertThat(path).isEqualTo(Path.of("/tmp/rec/recording_20240305_140709_3f2a9c1e.wav"));
    }

    @Test
    void shouldKeepShortSessionIdWhole() {
        TimestampedOutputPathProvider provider = new TimestampedOutputPathProvider(Path.of("/tmp/rec"), FIXED);

        assertThat(provider.newOutputPath("ab-12").getFileName().toString())
                .isEqualTo("recording_20240305_140709_ab12.wav");
    }

    @Test
    void shouldGiveDistinctPathsToSessionsInSameSecond() {
        TimestampedOutputPathProvider provider = new TimestampedOutputPathProvider(Path.of("/tmp/rec"), FIXED);

        assertThat(provider.newOutputPath("11111111-aaaa"))
                .isNotEqualTo(provider.newOutputPath("22222222-aaaa"));
    }

    @Test
    void shouldRejectNullSessionId() {
        TimestampedOutputPathProvider provider = new TimestampedOutputPathProvider(Path.of("/tmp/rec"));

        assertThatThrownBy(() -> provider.newOutputPath(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("sessionId");
    }
}
