/**
 * Exclusive access to the audio input device.
 *
 * <p>Every consumer that records from the microphone takes a {@link
 * com.phillippitts.voicecapture.service.audio.arbitration.DeviceFocusHandle} from the {@link
 * com.phillippitts.voicecapture.service.audio.arbitration.AudioDeviceArbiter} and reacts to the
 * focus changes it receives: stop on loss, pause on transient loss, resume on gain.
 *
 * @since 1.1
 */
package com.phillippitts.voicecapture.service.audio.arbitration;
