package com.phillippitts.voicecapture.service.permission;

/**
 * Answers whether the process may record from the microphone right now.
 *
 * <p>Checked before every recording starts; a negative answer fails the start with
 * a permission error without touching the device.
 */
@FunctionalInterface
public interface PermissionGate {

    boolean isRecordingPermitted();
}
