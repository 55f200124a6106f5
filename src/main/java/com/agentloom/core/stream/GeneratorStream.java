package com.agentloom.core.stream;

import com.agentloom.core.agents.AgentExecutionException;
import com.agentloom.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link EventStream} backed by a {@link Generator} running on its own thread.
 * <p>
 * Producer and consumer hand control back and forth: the body runs until it emits,
 * then parks inside {@link Emitter#emit} until the consumer calls {@link #hasNext()}
 * again. At most one of the two sides runs at any time. The body thread starts on the
 * first {@code hasNext()} and inherits the consumer's MDC.
 */
final class GeneratorStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(GeneratorStream.class);

    private final Executor executor;
    private final Generator body;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // guarded by lock
    private Event pending;
    private boolean resumeRequested;
    private boolean started;
    private boolean finished;
    private boolean cancelled;
    private Throwable failure;

    // consumer side only
    private Event lookahead;
    private boolean exhausted;

    GeneratorStream(Executor executor, Generator body) {
        this.executor = executor;
        this.body = body;
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        lock.lock();
        try {
            if (cancelled) {
                exhausted = true;
                return false;
            }
            if (!started) {
                start();
            } else {
                resumeRequested = true;
                changed.signalAll();
            }
            while (pending == null && !finished) {
                changed.await();
            }
            if (pending != null) {
                lookahead = pending;
                pending = null;
                return true;
            }
            exhausted = true;
            if (failure != null) {
                Throwable t = failure;
                failure = null;
                throw propagate(t);
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exhausted = true;
            cancelLocked();
            throw new AgentExecutionException("Interrupted while waiting for the next event", e);
        } finally {
            lock.unlock();
        }
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
        exhausted = true;
        lookahead = null;
        lock.lock();
        try {
            cancelLocked();
        } finally {
            lock.unlock();
        }
    }

    private void cancelLocked() {
        if (finished || cancelled) {
            return;
        }
        cancelled = true;
        if (!started) {
            finished = true;
        }
        changed.signalAll();
    }

    private void start() {
        started = true;
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            executor.execute(() -> produce(mdc));
        } catch (RejectedExecutionException e) {
            finished = true;
            failure = e;
        }
    }

    private void produce(Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            body.generate(this::emit);
        } catch (GeneratorCancelledException e) {
            log.debug("Generator cancelled by consumer");
        } catch (Throwable t) {
            lock.lock();
            try {
                failure = t;
            } finally {
                lock.unlock();
            }
        } finally {
            lock.lock();
            try {
                finished = true;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
            MDC.clear();
        }
    }

    private void emit(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        lock.lock();
        try {
            if (cancelled) {
                throw new GeneratorCancelledException();
            }
            pending = event;
            resumeRequested = false;
            changed.signalAll();
            while (!resumeRequested && !cancelled) {
                changed.awaitUninterruptibly();
            }
            resumeRequested = false;
            if (cancelled) {
                throw new GeneratorCancelledException();
            }
        } finally {
            lock.unlock();
        }
    }

    private static RuntimeException propagate(Throwable t) {
        if (t instanceof RuntimeException re) {
            return re;
        }
        if (t instanceof Error err) {
            throw err;
        }
        return new AgentExecutionException("Event generator failed: " + t.getMessage(), t);
    }
}
