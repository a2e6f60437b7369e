package com.phillippitts.voicecapture.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyForNullOrNonPositiveLimit() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview("hello", 0)).isEmpty();
        assertThat(LogSanitizer.preview("hello", -5)).isEmpty();
    }

    @Test
    void shouldKeepShortTextUnchanged() {
        assertThat(LogSanitizer.preview("hello world", 80)).isEqualTo("hello world");
        assertThat(LogSanitizer.preview("exact", 5)).isEqualTo("exact");
    }

    @Test
    void shouldCutLongTextAndMarkIt() {
        assertThat(LogSanitizer.preview("This is a long transcript", 9)).isEqualTo("This is a...");
    }

    @Test
    void shouldFlattenLineBreaksSoPreviewStaysOnOneLine() {
        String transcript = "first line\nsecond line\r\n\tthird";

        assertThat(LogSanitizer.preview(transcript, 80)).isEqualTo("first line second line third");
    }

    @Test
    void shouldIgnoreSurroundingWhitespace() {
        assertThat(LogSanitizer.preview("   \n  ", 10)).isEmpty();
        assertThat(LogSanitizer.preview("  padded  ", 10)).isEqualTo("padded");
    }
}
