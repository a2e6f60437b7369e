/**
 * Audio format utilities and conversions.
 *
 * <p>This package provides utilities for working with audio data in the application's
 * required format: 16kHz, 16-bit signed PCM, mono, little-endian.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.voicecapture.service.audio.AudioFormat} - Single source
 *       of truth for audio format constants and WAV header offsets</li>
 *   <li>{@link com.phillippitts.voicecapture.service.audio.Pcm16} - Little-endian byte and
 *       sample conversions</li>
 *   <li>{@link com.phillippitts.voicecapture.service.audio.WavWriter} - Writes samples as a
 *       44-byte RIFF header followed by the PCM payload</li>
 * </ul>
 *
 * <p>Usage Example:
 * <pre>
 * short[] samples = Pcm16.toSamples(buffer, bytesRead);
 * long size = WavWriter.writeMono16kHz(samples, path);
 * </pre>
 *
 * @see com.phillippitts.voicecapture.service.audio.capture
 * @since 1.0
 */
package com.phillippitts.voicecapture.service.audio;
