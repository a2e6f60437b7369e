/**
 * Domain models shared by capture, processing and the recording lifecycle.
 *
 * <p>All domain models are immutable records or enums and validate their components
 * in the constructor.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.voicecapture.domain.RecordingState} - Lifecycle state of the
 *       foreground recording (Idle, Recording, Processing, Success, Error)</li>
 *   <li>{@link com.phillippitts.voicecapture.domain.AudioFile} - Finalized WAV recording</li>
 *   <li>{@link com.phillippitts.voicecapture.domain.RecordingConstraints} - Size, duration and
 *       level thresholds derived from the transcription upload limit</li>
 *   <li>{@link com.phillippitts.voicecapture.domain.TranscriptionSettings} and
 *       {@link com.phillippitts.voicecapture.domain.TranscriptionResult} - Request and response
 *       of the transcription service</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicecapture.domain;
