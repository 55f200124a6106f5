package com.agentloom.core.runner;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors suitable for running agent generators and parallel branches.
 * <p>
 * Every generated stream parks one thread while it is suspended, so the pool must grow
 * with the nesting depth and fan-out of the agent tree; a bounded pool can deadlock.
 */
public final class RunnerExecutors {

    private RunnerExecutors() {}

    /**
     * Unbounded cached pool of daemon threads named {@code <prefix>-<n>}.
     */
    public static ExecutorService newCachedDaemonPool(String threadNamePrefix) {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, threadNamePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
