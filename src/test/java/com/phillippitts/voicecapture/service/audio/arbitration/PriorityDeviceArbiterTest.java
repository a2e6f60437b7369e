package com.phillippitts.voicecapture.service.audio.arbitration;

import com.phillippitts.voicecapture.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class PriorityDeviceArbiterTest {

    private final SyncExecutor notifier = new SyncExecutor();
    private final PriorityDeviceArbiter arbiter = new PriorityDeviceArbiter(notifier);

    @Test
    void firstAcquireIsGrantedWithoutNotifications() {
        Recorder recorder = new Recorder();
        DeviceFocusHandle handle = arbiter.newHandle("recorder");

        assertThat(handle.acquire(recorder)).isTrue();

        assertThat(handle.isHeld()).isTrue();
        assertThat(arbiter.currentHolder()).isEqualTo("recorder");
        assertThat(recorder.changes).isEmpty();
        assertThat(notifier.executedCount()).isZero();
    }

    @Test
    void permanentGainSendsLossAndDropsPreviousHolder() {
        Recorder first = new Recorder();
        DeviceFocusHandle a = arbiter.newHandle("a");
        DeviceFocusHandle b = arbiter.newHandle("b");
        a.acquire(first);

        b.acquire(new Recorder());

        assertThat(first.changes).containsExactly(DeviceFocusChange.LOSS);
        assertThat(a.isHeld()).isFalse();
        b.release();
        assertThat(first.changes).containsExactly(DeviceFocusChange.LOSS);
        assertThat(arbiter.currentHolder()).isNull();
    }

    @Test
    void transientGainPausesHolderAndRestoresFocusOnRelease() {
        Recorder recorder = new Recorder();
        DeviceFocusHandle session = arbiter.newHandle("session");
        DeviceFocusHandle prompt = arbiter.newHandle("prompt");
        session.acquire(recorder);

        prompt.acquire(FocusRequest.GAIN_TRANSIENT, change -> { });
        assertThat(arbiter.currentHolder()).isEqualTo("prompt");
        prompt.release();

        assertThat(recorder.changes).containsExactly(DeviceFocusChange.LOSS_TRANSIENT, DeviceFocusChange.GAIN);
        assertThat(arbiter.currentHolder()).isEqualTo("session");
    }

    @Test
    void duckableRequestSendsCanDuck() {
        Recorder recorder = new Recorder();
        arbiter.newHandle("session").acquire(recorder);

        arbiter.newHandle("chime").acquire(FocusRequest.GAIN_TRANSIENT_MAY_DUCK, change -> { });

        assertThat(recorder.changes).containsExactly(DeviceFocusChange.LOSS_TRANSIENT_CAN_DUCK);
    }

    @Test
    void exclusiveHolderRefusesOtherRequests() {
        DeviceFocusHandle call = arbiter.newHandle("call");
        call.acquire(FocusRequest.GAIN_TRANSIENT_EXCLUSIVE, change -> { });

        DeviceFocusHandle session = arbiter.newHandle("session");
        assertThat(session.acquire(new Recorder())).isFalse();
        assertThat(session.isHeld()).isFalse();

        call.release();
        assertThat(session.acquire(new Recorder())).isTrue();
    }

    @Test
    void releaseIsIdempotent() {
        Recorder recorder = new Recorder();
        DeviceFocusHandle session = arbiter.newHandle("session");
        DeviceFocusHandle other = arbiter.newHandle("other");
        session.acquire(recorder);
        other.acquire(FocusRequest.GAIN_TRANSIENT, change -> { });

        other.release();
        other.release();
        session.release();
        session.release();

        assertThat(recorder.changes).containsExactly(DeviceFocusChange.LOSS_TRANSIENT, DeviceFocusChange.GAIN);
        assertThat(arbiter.currentHolder()).isNull();
    }

    @Test
    void displacedHolderReleasingDoesNotNotifyTop() {
        Recorder top = new Recorder();
        DeviceFocusHandle session = arbiter.newHandle("session");
        DeviceFocusHandle prompt = arbiter.newHandle("prompt");
        session.acquire(new Recorder());
        prompt.acquire(FocusRequest.GAIN_TRANSIENT, top);

        session.release();

        assertThat(top.changes).isEmpty();
        assertThat(arbiter.currentHolder()).isEqualTo("prompt");
    }

    @Test
    void failingListenerDoesNotBreakArbitration() {
        DeviceFocusHandle a = arbiter.newHandle("a");
        a.acquire(change -> {
            throw new IllegalStateException("boom");
        });

        assertThat(arbiter.newHandle("b").acquire(new Recorder())).isTrue();
        assertThat(arbiter.currentHolder()).isEqualTo("b");
    }

    @Test
    void notificationsRunOnNotifierThread() throws Exception {
        ExecutorService exec = Executors.newSingleThreadExecutor(r -> new Thread(r, "device-arbiter-test"));
        try {
            PriorityDeviceArbiter async = new PriorityDeviceArbiter(exec);
            List<String> threads = new CopyOnWriteArrayList<>();
            async.newHandle("a").acquire(change -> threads.add(Thread.currentThread().getName()));

            async.newHandle("b").acquire(FocusRequest.GAIN_TRANSIENT, change -> { });

            await().atMost(2, TimeUnit.SECONDS).until(() -> !threads.isEmpty());
            assertThat(threads).containsExactly("device-arbiter-test");
        } finally {
            exec.shutdownNow();
            exec.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    private static final class Recorder implements DeviceFocusListener {
        final List<DeviceFocusChange> changes = new CopyOnWriteArrayList<>();

        @Override
        public void onFocusChange(DeviceFocusChange change) {
            changes.add(change);
        }
    }
}
