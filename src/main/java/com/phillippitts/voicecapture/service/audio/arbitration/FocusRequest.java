package com.phillippitts.voicecapture.service.audio.arbitration;

/**
 * Kind of device focus a consumer asks for.
 */
public enum FocusRequest {
    /** Long-lived ownership; the previous holders receive {@link DeviceFocusChange#LOSS}. */
    GAIN(DeviceFocusChange.LOSS),
    /** Short-lived ownership; the previous holder is paused and later regains focus. */
    GAIN_TRANSIENT(DeviceFocusChange.LOSS_TRANSIENT),
    /** Short-lived ownership that lets the previous holder duck instead of pausing. */
    GAIN_TRANSIENT_MAY_DUCK(DeviceFocusChange.LOSS_TRANSIENT_CAN_DUCK),
    /**
     * Short-lived ownership that refuses every other request until released
     * (calls, dictation prompts).
     */
    GAIN_TRANSIENT_EXCLUSIVE(DeviceFocusChange.LOSS_TRANSIENT);

    private final DeviceFocusChange displacedHolderChange;

    FocusRequest(DeviceFocusChange displacedHolderChange) {
        this.displacedHolderChange = displacedHolderChange;
    }

    /** Notification sent to the holder this request displaces. */
    public DeviceFocusChange displacedHolderChange() {
        return displacedHolderChange;
    }

    public boolean isTransient() {
        return this != GAIN;
    }
}
