package com.phillippitts.voicecapture.service.audio.arbitration;

/**
 * Receives focus changes for one {@link DeviceFocusHandle}.
 *
 * <p>Invoked on the arbiter's notification thread; implementations should hand work off
 * rather than block.
 */
@FunctionalInterface
public interface DeviceFocusListener {

    void onFocusChange(DeviceFocusChange change);
}
