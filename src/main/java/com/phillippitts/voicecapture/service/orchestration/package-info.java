/**
 * Recording lifecycle orchestration.
 *
 * <p>Drives one foreground recording at a time through
 * Idle → Recording → Processing → Success/Error and back to Idle.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.voicecapture.service.orchestration.RecordingOrchestrator} -
 *       Public commands (start, stop, cancel, retry) and observable state</li>
 *   <li>{@link com.phillippitts.voicecapture.service.orchestration.DefaultRecordingOrchestrator} -
 *       Sequences permission check, device arbitration, capture, processing progress and
 *       transcription</li>
 *   <li>{@link com.phillippitts.voicecapture.service.orchestration.RecordingStateMachine} -
 *       Holds the current state, applies guarded transitions and notifies listeners</li>
 *   <li>{@link com.phillippitts.voicecapture.service.orchestration.RecordingOrchestratorBuilder} -
 *       Construction with optional timing overrides</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Serialized commands:</b> every command and timer callback runs on a single-threaded
 *       executor, so transitions never interleave</li>
 *   <li><b>Session guards:</b> queued work names its session and is dropped once that session
 *       has ended</li>
 *   <li><b>Event-Driven:</b> lifecycle transitions are published as
 *       {@link com.phillippitts.voicecapture.service.orchestration.event.RecordingStateChangedEvent}</li>
 * </ul>
 *
 * @see com.phillippitts.voicecapture.service.audio.capture
 * @see com.phillippitts.voicecapture.service.audio.arbitration
 * @since 1.1
 */
package com.phillippitts.voicecapture.service.orchestration;
