package com.agentloom.core.runner;

import com.agentloom.core.agents.BaseAgent;
import com.agentloom.core.agents.InvocationContext;
import com.agentloom.core.agents.RunConfig;
import com.agentloom.core.artifacts.ArtifactService;
import com.agentloom.core.events.EventBus;
import com.agentloom.core.events.RunnerEvent;
import com.agentloom.core.logging.MdcContext;
import com.agentloom.core.memory.MemoryService;
import com.agentloom.core.metrics.RuntimeMetrics;
import com.agentloom.core.model.Content;
import com.agentloom.core.model.Event;
import com.agentloom.core.session.Session;
import com.agentloom.core.session.SessionService;
import com.agentloom.core.stream.EventStream;
import com.agentloom.core.stream.EventStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Drives one invocation of a root agent against a session.
 * <p>
 * The runner is the only component that commits events: each non-partial event pulled
 * from the root agent is appended to the session before it is handed to the caller, and
 * the agent is resumed only when the caller asks for the next event. Code after an
 * agent's yield therefore always sees the state its previous events wrote.
 */
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    public static final String USER_AUTHOR = "user";

    private final String appName;
    private final BaseAgent rootAgent;
    private final SessionService sessionService;
    private final ArtifactService artifactService;
    private final MemoryService memoryService;
    private final EventBus eventBus;
    private final RuntimeMetrics metrics;
    private final Executor executor;

    /**
     * @param eventBus nullable; lifecycle notifications are not published without one
     * @param metrics  nullable; nothing is recorded without one
     */
    public Runner(String appName, BaseAgent rootAgent, SessionService sessionService,
                  ArtifactService artifactService, MemoryService memoryService,
                  EventBus eventBus, RuntimeMetrics metrics, Executor executor) {
        this.appName = Objects.requireNonNull(appName, "appName must not be null");
        this.rootAgent = Objects.requireNonNull(rootAgent, "rootAgent must not be null");
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService must not be null");
        this.artifactService = artifactService;
        this.memoryService = memoryService;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public String appName() {
        return appName;
    }

    public BaseAgent rootAgent() {
        return rootAgent;
    }

    public SessionService sessionService() {
        return sessionService;
    }

    public ArtifactService artifactService() {
        return artifactService;
    }

    public MemoryService memoryService() {
        return memoryService;
    }

    /**
     * Starts an invocation. The session is loaded (or created under the given id) and the
     * new message is committed as a user event before this method returns; the agents
     * run lazily while the returned stream is consumed.
     *
     * @param newMessage user input, may be null to run the agents without new input
     */
    public EventStream run(String userId, String sessionId, Content newMessage, RunConfig runConfig) {
        Session session = sessionService.getSession(appName, userId, sessionId)
                .orElseGet(() -> sessionService.createSession(appName, userId, null, sessionId));
        String invocationId = "e-" + UUID.randomUUID();
        MdcContext.setInvocation(session.id(), invocationId);

        if (newMessage != null) {
            sessionService.appendEvent(session, Event.builder()
                    .invocationId(invocationId)
                    .author(USER_AUTHOR)
                    .content(newMessage)
                    .build());
        }

        var ctx = InvocationContext.builder()
                .invocationId(invocationId)
                .session(session)
                .userContent(newMessage)
                .sessionService(sessionService)
                .artifactService(artifactService)
                .memoryService(memoryService)
                .runConfig(runConfig)
                .executor(executor)
                .build();

        log.info("Invocation {} started: agent '{}', session {}", invocationId, rootAgent.name(), session.id());
        publish(ctx, RunnerEvent.INVOCATION_STARTED, null, Map.of("agent", rootAgent.name()));
        return new InvocationStream(ctx, rootAgent.run(ctx));
    }

    public EventStream run(String userId, String sessionId, Content newMessage) {
        return run(userId, sessionId, newMessage, RunConfig.defaults());
    }

    /**
     * Runs the invocation to completion and returns every event in order, partial ones included.
     */
    public List<Event> runToList(String userId, String sessionId, Content newMessage, RunConfig runConfig) {
        return EventStreams.toList(run(userId, sessionId, newMessage, runConfig));
    }

    public List<Event> runToList(String userId, String sessionId, Content newMessage) {
        return runToList(userId, sessionId, newMessage, RunConfig.defaults());
    }

    private void publish(InvocationContext ctx, String type, String author, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new RunnerEvent(type, ctx.session().id(), ctx.invocationId(), author,
                    payload, Instant.now()));
        }
    }

    /**
     * The caller-facing stream of one invocation: commits every non-partial event before
     * returning it.
     */
    private final class InvocationStream implements EventStream {

        private final InvocationContext ctx;
        private final EventStream root;
        private final long startMs = System.currentTimeMillis();
        private boolean terminated;
        private boolean ready;
        private int committed;

        InvocationStream(InvocationContext ctx, EventStream root) {
            this.ctx = ctx;
            this.root = root;
        }

        @Override
        public boolean hasNext() {
            if (terminated) {
                return false;
            }
            if (ready) {
                return true;
            }
            // an event already produced is still delivered; the flag stops the next one
            if (ctx.isEndInvocation()) {
                finish("ended", RunnerEvent.INVOCATION_ENDED);
                return false;
            }
            boolean more;
            try {
                more = root.hasNext();
            } catch (RuntimeException e) {
                fail(e);
                throw e;
            }
            if (!more) {
                finish("completed", RunnerEvent.INVOCATION_COMPLETED);
            }
            ready = more;
            return more;
        }

        @Override
        public Event next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ready = false;
            Event event = root.next();
            if (event.partial()) {
                if (metrics != null) {
                    metrics.recordPartialEvent(event.author());
                }
                return event;
            }
            try {
                sessionService.appendEvent(ctx.session(), event);
            } catch (RuntimeException e) {
                fail(e);
                throw e;
            }
            committed++;
            if (metrics != null) {
                metrics.recordCommittedEvent(event.author());
            }
            var payload = new HashMap<String, Object>();
            payload.put("eventId", event.id());
            payload.put("final", event.isFinalResponse());
            payload.put("stateKeys", List.copyOf(event.actions().stateDelta().keySet()));
            if (event.branch() != null) {
                payload.put("branch", event.branch());
            }
            publish(ctx, RunnerEvent.EVENT_COMMITTED, event.author(), payload);
            return event;
        }

        @Override
        public void close() {
            if (!terminated) {
                finish("ended", RunnerEvent.INVOCATION_ENDED);
            }
        }

        private void finish(String outcome, String eventType) {
            terminated = true;
            root.close();
            long elapsed = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordInvocation(appName, outcome, elapsed);
            }
            log.info("Invocation {} {} after {} committed events ({}ms)", ctx.invocationId(), outcome, committed, elapsed);
            publish(ctx, eventType, null, Map.of("committedEvents", committed));
            MdcContext.clear();
        }

        private void fail(RuntimeException e) {
            terminated = true;
            root.close();
            long elapsed = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordInvocation(appName, "failed", elapsed);
            }
            log.error("Invocation {} failed after {} committed events", ctx.invocationId(), committed, e);
            publish(ctx, RunnerEvent.INVOCATION_FAILED, null, Map.of(
                    "committedEvents", committed,
                    "error", String.valueOf(e.getMessage())));
            MdcContext.clear();
        }
    }
}
