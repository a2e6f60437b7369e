package com.phillippitts.voicecapture.service.audio.arbitration;

/**
 * Priority access to the audio input device shared by every consumer in the process.
 *
 * @see PriorityDeviceArbiter
 */
public interface AudioDeviceArbiter {

    /**
     * Creates a handle for a new consumer. The handle holds no focus until acquired.
     *
     * @param owner label used in logs
     */
    DeviceFocusHandle newHandle(String owner);

    /**
     * @return owner label of the current focus holder, or {@code null} when the device is free
     */
    String currentHolder();
}
