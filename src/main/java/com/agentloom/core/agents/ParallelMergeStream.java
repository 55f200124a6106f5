package com.agentloom.core.agents;

import com.agentloom.core.logging.MdcContext;
import com.agentloom.core.model.Event;
import com.agentloom.core.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;

/**
 * Merges the event streams of concurrently running children.
 * <p>
 * One pump task per child drains the child's stream into a shared queue. After handing
 * over an event the pump waits on that event's acknowledgement, which the consumer gives
 * on its next {@link #hasNext()}, i.e. after the event was committed upstream.
 */
final class ParallelMergeStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(ParallelMergeStream.class);

    private sealed interface Signal permits Item, Done, Failed {}

    private record Item(Event event, Semaphore ack) implements Signal {}

    private record Done(String branch) implements Signal {}

    private record Failed(String branch, Throwable error) implements Signal {}

    private final String agentName;
    private final InvocationContext ctx;
    private final Map<String, BaseAgent> branches;

    private final LinkedBlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private final Set<Thread> pumpThreads = ConcurrentHashMap.newKeySet();
    private final List<CompletableFuture<Void>> pumps = new ArrayList<>();
    private final List<String> failedBranches = new ArrayList<>();
    private final List<Throwable> failures = new ArrayList<>();

    private volatile boolean cancelled;
    private boolean started;
    private int running;
    private Event lookahead;
    private Semaphore pendingAck;

    ParallelMergeStream(String agentName, InvocationContext ctx, Map<String, BaseAgent> branches) {
        this.agentName = agentName;
        this.ctx = ctx;
        this.branches = branches;
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        releasePendingAck();
        if (cancelled) {
            return false;
        }
        if (!started) {
            start();
        }
        try {
            while (running > 0) {
                Signal signal = queue.take();
                if (signal instanceof Item item) {
                    lookahead = item.event();
                    pendingAck = item.ack();
                    return true;
                } else if (signal instanceof Done done) {
                    running--;
                    log.debug("Parallel branch {} completed", done.branch());
                } else if (signal instanceof Failed failed) {
                    running--;
                    failedBranches.add(failed.branch());
                    failures.add(failed.error());
                    log.warn("Parallel branch {} failed: {}", failed.branch(), failed.error().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new AgentExecutionException("Interrupted while waiting for parallel branches of '" + agentName + "'", e);
        }
        if (!failures.isEmpty()) {
            cancelled = true;
            throw new ParallelExecutionException(agentName, failedBranches, failures);
        }
        cancelled = true;
        return false;
    }

    @Override
    public Event next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Event event = lookahead;
        lookahead = null;
        return event;
    }

    @Override
    public void close() {
        if (cancelled && running == 0) {
            return;
        }
        cancelled = true;
        lookahead = null;
        releasePendingAck();
        synchronized (pumpThreads) {
            pumpThreads.forEach(Thread::interrupt);
        }
        Signal signal;
        while ((signal = queue.poll()) != null) {
            if (signal instanceof Item item) {
                item.ack().release();
            }
        }
        pumps.forEach(pump -> pump.cancel(false));
    }

    private void start() {
        started = true;
        running = branches.size();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        branches.forEach((branch, child) -> {
            InvocationContext childCtx = ctx.withBranch(branch);
            pumps.add(CompletableFuture.runAsync(() -> pump(branch, child, childCtx, mdc), ctx.executor()));
        });
        log.debug("Parallel agent '{}' started {} branches", agentName, branches.size());
    }

    private void pump(String branch, BaseAgent child, InvocationContext childCtx, Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        MdcContext.setAgent(child.name(), branch);
        synchronized (pumpThreads) {
            pumpThreads.add(Thread.currentThread());
        }
        try (EventStream events = child.run(childCtx)) {
            while (!cancelled && events.hasNext()) {
                var ack = new Semaphore(0);
                queue.put(new Item(events.next(), ack));
                ack.acquire();
            }
            queue.put(new Done(branch));
        } catch (InterruptedException e) {
            queue.add(new Failed(branch, e));
        } catch (Throwable t) {
            queue.add(new Failed(branch, t));
        } finally {
            synchronized (pumpThreads) {
                pumpThreads.remove(Thread.currentThread());
            }
            // clear an interrupt aimed at this pump before the pool thread is reused
            Thread.interrupted();
            MDC.clear();
        }
    }

    private void releasePendingAck() {
        if (pendingAck != null) {
            pendingAck.release();
            pendingAck = null;
        }
    }
}
