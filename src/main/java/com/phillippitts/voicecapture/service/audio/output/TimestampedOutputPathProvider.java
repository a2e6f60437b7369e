package com.phillippitts.voicecapture.service.audio.output;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Names recordings {@code recording_<yyyyMMdd_HHmmss>_<session>.wav} inside a fixed directory.
 */
public class TimestampedOutputPathProvider implements OutputPathProvider {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int SESSION_CHARS = 8;

    private final Path directory;
    private final Clock clock;

    public TimestampedOutputPathProvider(Path directory) {
        this(directory, Clock.systemDefaultZone());
    }

    TimestampedOutputPathProvider(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Path newOutputPath(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        String shortId = sessionId.replace("-", "");
        if (shortId.length() > SESSION_CHARS) {
            shortId = shortId.substring(0, SESSION_CHARS);
        }
        String name = "recording_" + LocalDateTime.now(clock).format(STAMP) + "_" + shortId + ".wav";
        return directory.resolve(name);
    }

    public Path directory() {
        return directory;
    }
}
