package com.agentloom.core.agents;

import com.agentloom.core.model.Event;
import com.agentloom.core.stream.EventStream;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Runs a list of agents one after another, optionally for several passes, on the
 * consumer's thread. Each child is started only after the previous child's stream is
 * exhausted, so it sees every event the previous child had committed.
 */
final class ChildSequenceStream implements EventStream {

    private final InvocationContext ctx;
    private final List<BaseAgent> children;
    private final int maxIterations;
    private final boolean stopOnEscalate;

    private int iteration;
    private int nextChild;
    private EventStream current;
    private boolean escalated;
    private boolean done;

    /**
     * @param maxIterations  number of passes over the children, 0 for no limit
     * @param stopOnEscalate end the sequence right after an event with {@code escalate=true}
     */
    ChildSequenceStream(InvocationContext ctx, List<BaseAgent> children, int maxIterations, boolean stopOnEscalate) {
        this.ctx = ctx;
        this.children = children;
        this.maxIterations = maxIterations;
        this.stopOnEscalate = stopOnEscalate;
        this.done = children.isEmpty();
    }

    @Override
    public boolean hasNext() {
        try {
            while (!done) {
                if (escalated) {
                    close();
                    return false;
                }
                if (current != null) {
                    if (current.hasNext()) {
                        return true;
                    }
                    current.close();
                    current = null;
                }
                if (ctx.isEndInvocation()) {
                    close();
                    return false;
                }
                if (nextChild == children.size()) {
                    nextChild = 0;
                    iteration++;
                    if (maxIterations > 0 && iteration >= maxIterations) {
                        close();
                        return false;
                    }
                }
                current = children.get(nextChild++).run(ctx);
            }
            return false;
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    @Override
    public Event next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Event event = current.next();
        if (stopOnEscalate && event.actions().escalate()) {
            escalated = true;
        }
        return event;
    }

    @Override
    public void close() {
        done = true;
        if (current != null) {
            current.close();
            current = null;
        }
    }
}
