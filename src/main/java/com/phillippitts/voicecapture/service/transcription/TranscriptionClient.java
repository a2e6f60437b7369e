package com.phillippitts.voicecapture.service.transcription;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.TranscriptionResult;
import com.phillippitts.voicecapture.domain.TranscriptionSettings;
import com.phillippitts.voicecapture.exception.TranscriptionException;

/**
 * Sends a finished recording to a speech-to-text service.
 *
 * <p>The recording orchestrator calls {@link #transcribe} exactly once per successful
 * recording, from its orchestration thread. Implementations may block for the duration
 * of the request.
 *
 * @since 1.1
 */
public interface TranscriptionClient {

    /**
     * Transcribes the given WAV file.
     *
     * @param audio finished recording (PCM16LE mono 16 kHz WAV)
     * @param settings request settings snapshot
     * @return transcription result
     * @throws TranscriptionException when the service rejects or fails the request
     */
    TranscriptionResult transcribe(AudioFile audio, TranscriptionSettings settings);
}
