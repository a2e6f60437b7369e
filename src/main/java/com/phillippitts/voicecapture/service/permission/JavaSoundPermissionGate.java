package com.phillippitts.voicecapture.service.permission;

import com.phillippitts.voicecapture.service.audio.capture.JavaSoundAudioCaptureService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.TargetDataLine;

/**
 * Permission gate asking Java Sound whether a capture line for the required format exists.
 *
 * <p>Operating systems that withhold microphone access usually hide the capture lines or throw
 * {@link SecurityException} when they are queried; both count as "not permitted".
 */
public class JavaSoundPermissionGate implements PermissionGate {

    private static final Logger LOG = LogManager.getLogger(JavaSoundPermissionGate.class);

    @Override
    public boolean isRecordingPermitted() {
        try {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class,
                    JavaSoundAudioCaptureService.requiredFormat());
            boolean supported = AudioSystem.isLineSupported(info);
            if (!supported) {
                LOG.warn("No capture line supports the required format; recording not permitted");
            }
            return supported;
        } catch (SecurityException e) {
            LOG.warn("Microphone access denied by the platform: {}", e.getMessage());
            return false;
        }
    }
}
