package com.phillippitts.voicecapture.service.health;

import com.phillippitts.voicecapture.domain.RecordingState;
import com.phillippitts.voicecapture.service.audio.arbitration.AudioDeviceArbiter;
import com.phillippitts.voicecapture.service.audio.capture.AudioCaptureService;
import com.phillippitts.voicecapture.service.orchestration.RecordingStateMachine;
import com.phillippitts.voicecapture.service.permission.PermissionGate;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the recording pipeline.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: microphone accessible and the last recording did not fail</li>
 *   <li>DEGRADED: microphone accessible but the recording is in the error state</li>
 *   <li>DOWN: microphone access denied or no capture line for the required format</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RecordingHealthIndicator implements HealthIndicator {

    private final PermissionGate permissionGate;
    private final RecordingStateMachine stateMachine;
    private final AudioCaptureService captureService;
    private final AudioDeviceArbiter arbiter;

    public RecordingHealthIndicator(PermissionGate permissionGate,
                                    RecordingStateMachine stateMachine,
                                    AudioCaptureService captureService,
                                    AudioDeviceArbiter arbiter) {
        this.permissionGate = permissionGate;
        this.stateMachine = stateMachine;
        this.captureService = captureService;
        this.arbiter = arbiter;
    }

    @Override
    public Health health() {
        boolean permitted = permissionGate.isRecordingPermitted();
        RecordingState state = stateMachine.current();
        String holder = arbiter.currentHolder();

        Health.Builder builder = new Health.Builder();
        if (!permitted) {
            builder.down().withDetail("status", "Microphone unavailable");
        } else if (state instanceof RecordingState.Error error) {
            builder.status("DEGRADED")
                    .withDetail("status", "Last recording failed")
                    .withDetail("error", error.message())
                    .withDetail("retryable", error.retryable());
        } else {
            builder.up().withDetail("status", "Ready");
        }
        return builder
                .withDetail("microphone", permitted ? "permitted" : "denied")
                .withDetail("state", state.name())
                .withDetail("capture", captureService.state().name())
                .withDetail("device", holder == null ? "free" : holder)
                .build();
    }
}
