/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicecapture.exception.VoiceCaptureException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicecapture.exception.CaptureException} - Thrown when the
 *       microphone cannot be opened or capture fails; classified by
 *       {@link com.phillippitts.voicecapture.exception.CaptureErrorKind}</li>
 *   <li>{@link com.phillippitts.voicecapture.exception.RecordingTimeoutException} - Thrown when a
 *       recording exceeds the maximum allowed duration (not retryable)</li>
 *   <li>{@link com.phillippitts.voicecapture.exception.TranscriptionException} - Thrown when the
 *       transcription service fails to process a recording</li>
 * </ul>
 *
 * <p>Exceptions never escape the capture thread or the recording executor. They are turned
 * into {@code RecordingState.Error} transitions and {@code CaptureErrorEvent}s.
 *
 * @see com.phillippitts.voicecapture.exception.VoiceCaptureException
 * @since 1.0
 */
package com.phillippitts.voicecapture.exception;
