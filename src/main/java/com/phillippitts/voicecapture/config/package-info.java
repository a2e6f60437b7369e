/**
 * Application-wide configuration beans and properties.
 *
 * <p>This package contains Spring configuration classes that define beans and load
 * externalized configuration from {@code application.properties}.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.voicecapture.config.ThreadPoolConfig} - Recording executor,
 *       timer scheduler and device arbitration executor</li>
 *   <li>{@link com.phillippitts.voicecapture.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for the recording executor queue</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.audio} - Capture properties ({@code audio.capture.*}) and the derived
 *       {@link com.phillippitts.voicecapture.domain.RecordingConstraints}</li>
 *   <li>{@code config.recording} - Recording lifecycle and transcription request properties</li>
 *   <li>{@code config.orchestration} - Wiring of the recording orchestrator and its ports</li>
 *   <li>{@code config.properties} - Thread pool properties ({@code threadpool.*})</li>
 * </ul>
 *
 * @see com.phillippitts.voicecapture.config.orchestration.OrchestrationConfig
 * @since 1.0
 */
package com.phillippitts.voicecapture.config;
