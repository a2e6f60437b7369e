package com.phillippitts.voicecapture.service.health;

import com.phillippitts.voicecapture.domain.RecordingState;
import com.phillippitts.voicecapture.service.audio.arbitration.AudioDeviceArbiter;
import com.phillippitts.voicecapture.service.audio.capture.AudioCaptureService;
import com.phillippitts.voicecapture.service.audio.capture.CaptureState;
import com.phillippitts.voicecapture.service.orchestration.RecordingStateMachine;
import com.phillippitts.voicecapture.service.permission.PermissionGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecordingHealthIndicatorTest {

    private PermissionGate gate;
    private RecordingStateMachine stateMachine;
    private AudioCaptureService capture;
    private AudioDeviceArbiter arbiter;
    private RecordingHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        gate = mock(PermissionGate.class);
        capture = mock(AudioCaptureService.class);
        arbiter = mock(AudioDeviceArbiter.class);
        stateMachine = new RecordingStateMachine();
        when(capture.state()).thenReturn(CaptureState.IDLE);
        indicator = new RecordingHealthIndicator(gate, stateMachine, capture, arbiter);
    }

    @Test
    void shouldReportUpWhenPermittedAndIdle() {
        when(gate.isRecordingPermitted()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("state", "IDLE");
        assertThat(health.getDetails()).containsEntry("capture", "IDLE");
        assertThat(health.getDetails()).containsEntry("device", "free");
        assertThat(health.getDetails()).containsEntry("microphone", "permitted");
    }

    @Test
    void shouldReportDownWhenMicrophoneDenied() {
        when(gate.isRecordingPermitted()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("microphone", "denied");
    }

    @Test
    void shouldReportDegradedInErrorState() {
        when(gate.isRecordingPermitted()).thenReturn(true);
        stateMachine.force(new RecordingState.Error("Upload failed", true));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("error", "Upload failed");
        assertThat(health.getDetails()).containsEntry("retryable", true);
    }

    @Test
    void shouldShowDeviceHolderWhileRecording() {
        when(gate.isRecordingPermitted()).thenReturn(true);
        when(capture.state()).thenReturn(CaptureState.ACTIVE);
        when(arbiter.currentHolder()).thenReturn("recording-abc");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("capture", "ACTIVE");
        assertThat(health.getDetails()).containsEntry("device", "recording-abc");
    }
}
