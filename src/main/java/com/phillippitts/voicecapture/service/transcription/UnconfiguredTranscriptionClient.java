package com.phillippitts.voicecapture.service.transcription;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.TranscriptionResult;
import com.phillippitts.voicecapture.domain.TranscriptionSettings;
import com.phillippitts.voicecapture.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Placeholder client registered when the application provides no {@link TranscriptionClient}.
 *
 * <p>Every request fails with a {@link TranscriptionException}, which the orchestrator turns
 * into a retryable error state. The recording itself is kept on disk.
 */
public class UnconfiguredTranscriptionClient implements TranscriptionClient {

    private static final Logger LOG = LogManager.getLogger(UnconfiguredTranscriptionClient.class);

    @Override
    public TranscriptionResult transcribe(AudioFile audio, TranscriptionSettings settings) {
        LOG.warn("No transcription client configured; recording {} left untranscribed",
                audio.path().getFileName());
        throw new TranscriptionException("No transcription client configured", settings.model());
    }
}
