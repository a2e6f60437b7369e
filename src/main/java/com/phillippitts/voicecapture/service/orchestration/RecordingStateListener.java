package com.phillippitts.voicecapture.service.orchestration;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.RecordingState;

/**
 * Observer of the recording lifecycle.
 *
 * <p>Callbacks run on the orchestration thread. A listener that throws is logged and
 * skipped; the remaining listeners are still notified.
 *
 * @since 1.1
 */
public interface RecordingStateListener {

    /**
     * Called after every state change.
     *
     * @param previous state before the change
     * @param current state after the change
     */
    default void onStateChanged(RecordingState previous, RecordingState current) {
    }

    /** Called once per recording whose file was finalized, before transcription starts. */
    default void onRecordingComplete(AudioFile audioFile) {
    }

    /** Called for recording failures and warnings such as the size-limit stop. */
    default void onRecordingError(String message) {
    }
}
