package com.phillippitts.voicecapture.service.orchestration.event;

import com.phillippitts.voicecapture.domain.RecordingState;

import java.time.Instant;

/**
 * Emitted after every recording state transition, including live duration updates.
 *
 * @param previous state before the transition
 * @param current state after the transition
 * @param timestamp when the transition happened
 */
public record RecordingStateChangedEvent(
        RecordingState previous,
        RecordingState current,
        Instant timestamp
) {}
