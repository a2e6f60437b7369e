/**
 * Service layer containing the recording pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.audio} - PCM/WAV utilities, capture engine, quality analysis,
 *       processing, device arbitration and output paths</li>
 *   <li>{@code service.orchestration} - Recording lifecycle state machine and orchestrator</li>
 *   <li>{@code service.transcription} - Transcription client and settings ports</li>
 *   <li>{@code service.permission} - Microphone permission check</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - Micrometer
 *       meters, actuator health and error event logging</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services depend on domain models and ports, not on Spring configuration</li>
 *   <li>Services throw domain exceptions from {@code com.phillippitts.voicecapture.exception}</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicecapture.service;
