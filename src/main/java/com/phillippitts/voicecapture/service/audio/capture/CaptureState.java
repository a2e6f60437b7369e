package com.phillippitts.voicecapture.service.audio.capture;

/** Capture engine state. */
public enum CaptureState {
    IDLE,
    ACTIVE,
    PAUSED,
    STOPPING
}
