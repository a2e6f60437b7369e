package com.phillippitts.voicecapture.service.audio.capture;

import com.phillippitts.voicecapture.exception.CaptureErrorKind;

import java.time.Instant;

/**
 * Published when microphone capture fails (permissions, device errors, I/O, etc.).
 *
 * Payload contains the failure kind and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(CaptureErrorKind kind, Instant at) { }
