package com.phillippitts.voicecapture.service.audio.arbitration;

/**
 * Focus notifications delivered to the holder of an audio input device.
 */
public enum DeviceFocusChange {
    /** Focus (re)gained; capture may run. */
    GAIN,
    /** Focus lost for good; the holder will not get it back. */
    LOSS,
    /** Another consumer holds the device for a short while; GAIN follows when it releases. */
    LOSS_TRANSIENT,
    /** Same as {@link #LOSS_TRANSIENT}, but the new holder tolerates a lowered-priority capture. */
    LOSS_TRANSIENT_CAN_DUCK
}
