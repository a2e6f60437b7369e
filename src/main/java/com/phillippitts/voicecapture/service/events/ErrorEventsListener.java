package com.phillippitts.voicecapture.service.events;

import com.phillippitts.voicecapture.domain.RecordingState;
import com.phillippitts.voicecapture.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.voicecapture.service.orchestration.event.RecordingStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Capture error: kind={}. {}", e.kind(), hint(e));
        }
    }

    @EventListener
    void onRecordingStateChanged(RecordingStateChangedEvent e) {
        if (e.current() instanceof RecordingState.Error error
                && shouldLog("recording-" + error.retryable() + '-' + error.message())) {
            LOG.warn("Recording failed: {} (retryable={})", error.message(), error.retryable());
        }
    }

    private static String hint(CaptureErrorEvent e) {
        return switch (e.kind()) {
            case PERMISSION_DENIED -> "Grant microphone access to the JVM in the OS privacy settings.";
            case DEVICE_UNAVAILABLE -> "Check that a microphone is connected and not held by another application.";
            case CONFIGURATION_ERROR -> "Check audio.capture.* properties.";
            case IO_ERROR -> "Check recording.output-dir is writable.";
            default -> "Check microphone device & permissions.";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
