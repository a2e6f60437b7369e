package com.phillippitts.voicecapture.service.transcription;

import com.phillippitts.voicecapture.domain.TranscriptionSettings;

/**
 * Source of the user's current transcription preferences.
 */
@FunctionalInterface
public interface SettingsProvider {

    /**
     * @return a snapshot of the current settings; never {@code null}
     */
    TranscriptionSettings currentSettings();
}
