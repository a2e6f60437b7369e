package com.phillippitts.voicecapture.service.audio.arbitration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Focus-stack arbiter for the audio input device.
 *
 * <p>The top of the stack owns the device. A new request displaces the current owner:
 * <ul>
 *   <li>{@link FocusRequest#GAIN} sends {@link DeviceFocusChange#LOSS} to every holder and
 *       clears the stack</li>
 *   <li>transient requests send the request's displacement change to the current owner only,
 *       which stays on the stack and receives {@link DeviceFocusChange#GAIN} once the
 *       transient owner releases</li>
 *   <li>while a {@link FocusRequest#GAIN_TRANSIENT_EXCLUSIVE} owner is on top, other
 *       requests are refused</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> the stack is guarded by a monitor; notifications are dispatched
 * outside it on the arbiter executor, one at a time, in the order they were decided.
 *
 * @since 1.1
 */
@Component
public class PriorityDeviceArbiter implements AudioDeviceArbiter {

    private static final Logger LOG = LogManager.getLogger(PriorityDeviceArbiter.class);

    private final Executor notifier;
    private final Object lock = new Object();
    private final Deque<Holder> stack = new ArrayDeque<>();

    public PriorityDeviceArbiter(@Qualifier("arbiterExecutor") Executor notifier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
    }

    @Override
    public DeviceFocusHandle newHandle(String owner) {
        Objects.requireNonNull(owner, "owner must not be null");
        return new Handle(owner);
    }

    @Override
    public String currentHolder() {
        synchronized (lock) {
            Holder top = stack.peekFirst();
            return top == null ? null : top.handle.owner;
        }
    }

    private boolean acquire(Handle handle, FocusRequest request, DeviceFocusListener listener) {
        List<Notification> notifications = new ArrayList<>();
        synchronized (lock) {
            Holder top = stack.peekFirst();
            if (top != null && top.handle != handle && top.request == FocusRequest.GAIN_TRANSIENT_EXCLUSIVE) {
                LOG.info("Focus request from '{}' refused; '{}' holds the device exclusively",
                        handle.owner, top.handle.owner);
                return false;
            }
            stack.removeIf(h -> h.handle == handle);
            if (request == FocusRequest.GAIN) {
                for (Holder h : stack) {
                    notifications.add(new Notification(h, DeviceFocusChange.LOSS));
                }
                stack.clear();
            } else {
                Holder displaced = stack.peekFirst();
                if (displaced != null) {
                    notifications.add(new Notification(displaced, request.displacedHolderChange()));
                }
            }
            stack.addFirst(new Holder(handle, request, listener));
            LOG.debug("Device focus {} granted to '{}' (stack depth {})", request, handle.owner, stack.size());
        }
        dispatch(notifications);
        return true;
    }

    private void release(Handle handle) {
        List<Notification> notifications = new ArrayList<>();
        synchronized (lock) {
            Holder top = stack.peekFirst();
            if (top != null && top.handle == handle) {
                stack.removeFirst();
                Holder next = stack.peekFirst();
                if (next != null) {
                    notifications.add(new Notification(next, DeviceFocusChange.GAIN));
                }
                LOG.debug("Device focus released by '{}'", handle.owner);
            } else if (stack.removeIf(h -> h.handle == handle)) {
                LOG.debug("Displaced holder '{}' left the focus stack", handle.owner);
            }
        }
        dispatch(notifications);
    }

    private boolean isHeld(Handle handle) {
        synchronized (lock) {
            return stack.stream().anyMatch(h -> h.handle == handle);
        }
    }

    private void dispatch(List<Notification> notifications) {
        for (Notification n : notifications) {
            LOG.info("Device focus {} for '{}'", n.change, n.holder.handle.owner);
            try {
                notifier.execute(() -> deliver(n));
            } catch (RejectedExecutionException e) {
                LOG.warn("Dropped focus {} for '{}': {}", n.change, n.holder.handle.owner, e.getMessage());
            }
        }
    }

    private static void deliver(Notification n) {
        try {
            n.holder.listener.onFocusChange(n.change);
        } catch (RuntimeException e) {
            LOG.warn("Focus listener of '{}' failed: {}", n.holder.handle.owner, e.toString());
        }
    }

    private record Holder(Handle handle, FocusRequest request, DeviceFocusListener listener) {
    }

    private record Notification(Holder holder, DeviceFocusChange change) {
    }

    private final class Handle implements DeviceFocusHandle {
        private final String owner;

        Handle(String owner) {
            this.owner = owner;
        }

        @Override
        public boolean acquire(FocusRequest request, DeviceFocusListener listener) {
            Objects.requireNonNull(request, "request must not be null");
            Objects.requireNonNull(listener, "listener must not be null");
            return PriorityDeviceArbiter.this.acquire(this, request, listener);
        }

        @Override
        public void release() {
            PriorityDeviceArbiter.this.release(this);
        }

        @Override
        public boolean isHeld() {
            return PriorityDeviceArbiter.this.isHeld(this);
        }

        @Override
        public String owner() {
            return owner;
        }
    }
}
