package com.phillippitts.voicecapture.service.audio.output;

import java.nio.file.Path;

/**
 * Allocates the file a recording session writes to.
 */
@FunctionalInterface
public interface OutputPathProvider {

    /**
     * @param sessionId identifier of the session being started
     * @return a path that does not collide with earlier recordings; parent directories
     *         need not exist yet
     */
    Path newOutputPath(String sessionId);
}
