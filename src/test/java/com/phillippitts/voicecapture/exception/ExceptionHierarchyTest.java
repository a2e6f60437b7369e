package com.phillippitts.voicecapture.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void voiceCaptureExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        VoiceCaptureException ex = new VoiceCaptureException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void captureExceptionUsesKindMessageWhenNoDetail() {
        CaptureException ex = new CaptureException(CaptureErrorKind.PERMISSION_DENIED);

        assertThat(ex.getMessage()).isEqualTo("Audio recording permission denied");
        assertThat(ex.getKind()).isEqualTo(CaptureErrorKind.PERMISSION_DENIED);
        assertThat(ex).isInstanceOf(VoiceCaptureException.class);
    }

    @Test
    void captureExceptionAppendsDetail() {
        IOException cause = new IOException("disk full");
        CaptureException ex = new CaptureException(CaptureErrorKind.IO_ERROR, "disk full", cause);

        assertThat(ex.getMessage()).isEqualTo("Audio I/O error: disk full");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void recordingTimeoutExceptionShouldIncludeLimit() {
        RecordingTimeoutException ex = new RecordingTimeoutException(819_200L);

        assertThat(ex.getMessage()).contains("819200");
        assertThat(ex.getLimitMs()).isEqualTo(819_200L);
    }

    @Test
    void transcriptionExceptionShouldIncludeModel() {
        TranscriptionException ex = new TranscriptionException("service returned 500", "whisper-1");

        assertThat(ex.getMessage()).contains("service returned 500").contains("whisper-1");
        assertThat(ex.getModel()).isEqualTo("whisper-1");
    }

    @Test
    void transcriptionExceptionDefaultsModelToUnknown() {
        TranscriptionException ex = new TranscriptionException("transcription failed");

        assertThat(ex.getMessage()).isEqualTo("transcription failed");
        assertThat(ex.getModel()).isEqualTo("unknown");
    }
}
