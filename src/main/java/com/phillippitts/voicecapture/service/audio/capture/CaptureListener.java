package com.phillippitts.voicecapture.service.audio.capture;

import com.phillippitts.voicecapture.exception.CaptureException;

/**
 * Callbacks from the capture thread. Implementations must not block: they run on the
 * capture thread and should only hand work off to another executor.
 */
public interface CaptureListener {

    /** No-op listener. */
    CaptureListener NONE = new CaptureListener() { };

    /** The session failed and has been torn down; no file will be produced. */
    default void onCaptureError(CaptureException error) {
    }

    /**
     * Capture stopped reading because the encoded file reached the force-stop size.
     * The file is finalized; a subsequent {@link AudioCaptureService#stop()} returns it.
     *
     * @param fileSizeBytes encoded size at the moment capture stopped
     */
    default void onSizeLimitReached(long fileSizeBytes) {
    }
}
