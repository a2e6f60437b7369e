package com.phillippitts.voicecapture.service.audio.arbitration;

/**
 * One consumer's claim on the audio input device.
 *
 * <p>Handles are cheap and single-use per session: acquire when capture starts, release
 * during cleanup. {@link #release()} is idempotent.
 */
public interface DeviceFocusHandle {

    /**
     * Requests focus.
     *
     * @param request kind of focus wanted
     * @param listener receives later focus changes for this handle
     * @return {@code true} when focus was granted, {@code false} when another holder refuses it
     */
    boolean acquire(FocusRequest request, DeviceFocusListener listener);

    /**
     * Requests long-lived focus.
     */
    default boolean acquire(DeviceFocusListener listener) {
        return acquire(FocusRequest.GAIN, listener);
    }

    /**
     * Gives focus back. Does nothing when the handle holds no focus.
     */
    void release();

    /**
     * @return {@code true} while this handle is on the arbiter's focus stack
     */
    boolean isHeld();

    String owner();
}
