package com.phillippitts.voicecapture.service.orchestration;

import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.RecordingState;
import com.phillippitts.voicecapture.domain.RecordingStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Thread-safe holder of the single foreground {@link RecordingState}.
 *
 * <p>Every transition is a compare-and-set: it names the state (or state kind) it expects and
 * fails without side effects when the current state differs. Stale timers and duplicate
 * requests therefore become no-ops instead of corrupting a newer session.
 *
 * <p><b>Thread Safety:</b> the state is guarded by a {@link ReentrantLock}. Listeners are
 * notified after the lock is released, each in its own try block, so a failing or slow
 * listener never blocks a transition.
 *
 * @since 1.1
 */
public final class RecordingStateMachine {

    private static final Logger LOG = LogManager.getLogger(RecordingStateMachine.class);

    private final Lock lock = new ReentrantLock();
    private final List<RecordingStateListener> listeners = new CopyOnWriteArrayList<>();
    private RecordingState state = RecordingState.idle();

    public RecordingState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean is(RecordingStatus status) {
        return current().status() == status;
    }

    /**
     * Replaces {@code expected} with {@code next}.
     *
     * @return {@code true} if the current state equalled {@code expected}
     */
    public boolean compareAndSet(RecordingState expected, RecordingState next) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(next, "next must not be null");
        RecordingState previous;
        lock.lock();
        try {
            if (!state.equals(expected)) {
                LOG.debug("Transition {} -> {} skipped; state is {}", expected.name(), next.name(), state.name());
                return false;
            }
            previous = state;
            state = next;
        } finally {
            lock.unlock();
        }
        LOG.info("Recording state {} -> {}", previous.name(), next.name());
        fireStateChanged(previous, next);
        return true;
    }

    /**
     * Moves to {@code next} if the current state is of kind {@code expected}.
     *
     * @return the state that was replaced, or {@code null} if the guard failed
     */
    public RecordingState transitionFrom(RecordingStatus expected, RecordingState next) {
        Objects.requireNonNull(next, "next must not be null");
        RecordingState previous;
        lock.lock();
        try {
            if (state.status() != expected) {
                LOG.debug("Transition {} -> {} skipped; state is {}", expected, next.name(), state.name());
                return null;
            }
            previous = state;
            state = next;
        } finally {
            lock.unlock();
        }
        LOG.info("Recording state {} -> {}", previous.name(), next.name());
        fireStateChanged(previous, next);
        return previous;
    }

    /**
     * Unconditionally moves to {@code next}.
     *
     * @return the state that was replaced
     */
    public RecordingState force(RecordingState next) {
        Objects.requireNonNull(next, "next must not be null");
        RecordingState previous;
        lock.lock();
        try {
            previous = state;
            state = next;
        } finally {
            lock.unlock();
        }
        if (!previous.equals(next)) {
            LOG.info("Recording state {} -> {} (forced)", previous.name(), next.name());
            fireStateChanged(previous, next);
        }
        return previous;
    }

    /**
     * Refreshes the live duration of the given recording session.
     *
     * @return {@code false} if that session is no longer recording
     */
    public boolean updateDuration(String sessionId, long durationMs) {
        RecordingState previous;
        RecordingState next;
        lock.lock();
        try {
            if (!(state instanceof RecordingState.Recording recording)
                    || !recording.sessionId().equals(sessionId)) {
                return false;
            }
            previous = state;
            next = recording.withDuration(durationMs);
            state = next;
        } finally {
            lock.unlock();
        }
        fireStateChanged(previous, next);
        return true;
    }

    public void addListener(RecordingStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(RecordingStateListener listener) {
        listeners.remove(listener);
    }

    void fireRecordingComplete(AudioFile audioFile) {
        notifyEach(l -> l.onRecordingComplete(audioFile));
    }

    void fireRecordingError(String message) {
        notifyEach(l -> l.onRecordingError(message));
    }

    private void fireStateChanged(RecordingState previous, RecordingState next) {
        notifyEach(l -> l.onStateChanged(previous, next));
    }

    private void notifyEach(Consumer<RecordingStateListener> call) {
        for (RecordingStateListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Recording state listener {} failed: {}", listener.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
