package com.phillippitts.voicecapture.service.audio.quality;

/** Output of {@link SilenceDetector#processSample(boolean)}. */
public enum SilenceState {
    NOT_SILENT,
    ENTERED_SILENCE,
    IN_SILENCE,
    EXITED_SILENCE
}
