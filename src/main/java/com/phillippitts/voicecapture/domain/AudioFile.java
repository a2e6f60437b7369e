package com.phillippitts.voicecapture.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A finalized WAV recording ready for upload.
 *
 * <p>Created only when a capture session stops successfully; cancelled or failed sessions
 * never produce one.
 *
 * @param path       location of the WAV file (44-byte header followed by PCM16LE mono 16 kHz)
 * @param durationMs duration of the encoded audio in milliseconds
 * @param sizeBytes  size of the WAV file on disk, header included
 * @param sessionId  identifier of the capture session that produced the file
 */
public record AudioFile(Path path, long durationMs, long sizeBytes, String sessionId) {

    public AudioFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0, got: " + durationMs);
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0, got: " + sizeBytes);
        }
    }
}
