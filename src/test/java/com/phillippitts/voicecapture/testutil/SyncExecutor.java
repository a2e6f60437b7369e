package com.phillippitts.voicecapture.testutil;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that runs each task on the submitting thread.
 *
 * <p>Handed to the device arbiter in tests so focus notifications are delivered before
 * {@code acquire} or {@code release} returns.
 */
public class SyncExecutor implements Executor {

    private final AtomicInteger executed = new AtomicInteger();

    @Override
    public void execute(Runnable command) {
        executed.incrementAndGet();
        command.run();
    }

    /** Number of tasks run so far. */
    public int executedCount() {
        return executed.get();
    }
}
