package com.phillippitts.voicecapture.domain;

/**
 * Discriminator for {@link RecordingState} variants, used for exhaustive switches.
 */
public enum RecordingStatus {
    IDLE,
    RECORDING,
    PROCESSING,
    SUCCESS,
    ERROR
}
