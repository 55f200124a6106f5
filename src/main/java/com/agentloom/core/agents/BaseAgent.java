package com.agentloom.core.agents;

import com.agentloom.core.callbacks.AfterAgentCallback;
import com.agentloom.core.callbacks.BeforeAgentCallback;
import com.agentloom.core.callbacks.CallbackChain;
import com.agentloom.core.logging.MdcContext;
import com.agentloom.core.model.Content;
import com.agentloom.core.model.Event;
import com.agentloom.core.stream.EventStream;
import com.agentloom.core.stream.EventStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * A composable execution unit that turns an {@link InvocationContext} into a lazy
 * {@link EventStream}.
 * <p>
 * The set of variants is closed: the model-backed {@link LlmAgent}, the three composition
 * operators {@link SequentialAgent}, {@link ParallelAgent} and {@link LoopAgent}, and
 * {@link CustomAgent} as the single extension point for user-defined logic.
 * <p>
 * Agents form a tree. A sub-agent gets its parent when the parent is constructed and
 * can never be attached to a second parent.
 */
public abstract sealed class BaseAgent permits LlmAgent, SequentialAgent, ParallelAgent, LoopAgent, CustomAgent {

    private static final Logger log = LoggerFactory.getLogger(BaseAgent.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String RESERVED_NAME = "user";

    private final String name;
    private final String description;
    private final List<BaseAgent> subAgents;
    private final List<BeforeAgentCallback> beforeAgentCallbacks;
    private final List<AfterAgentCallback> afterAgentCallbacks;
    private BaseAgent parentAgent;

    protected BaseAgent(String name, String description, List<? extends BaseAgent> subAgents,
                        List<BeforeAgentCallback> beforeAgentCallbacks,
                        List<AfterAgentCallback> afterAgentCallbacks) {
        this.name = validateName(name);
        this.description = description == null ? "" : description;
        this.subAgents = subAgents == null ? List.of() : List.copyOf(subAgents);
        this.beforeAgentCallbacks = beforeAgentCallbacks == null ? List.of() : List.copyOf(beforeAgentCallbacks);
        this.afterAgentCallbacks = afterAgentCallbacks == null ? List.of() : List.copyOf(afterAgentCallbacks);

        var seen = new HashSet<String>();
        for (BaseAgent child : this.subAgents) {
            if (!seen.add(child.name)) {
                throw new IllegalArgumentException("Agent '" + name + "' has two sub-agents named '" + child.name + "'");
            }
        }
        for (BaseAgent child : this.subAgents) {
            if (child.parentAgent != null) {
                throw new IllegalArgumentException("Agent '" + child.name + "' already has parent '"
                        + child.parentAgent.name + "' and cannot be added to '" + name + "'");
            }
        }
        this.subAgents.forEach(child -> child.parentAgent = this);
    }

    private static String validateName(String name) {
        Objects.requireNonNull(name, "agent name must not be null");
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Agent name '" + name
                    + "' must start with a letter or underscore and contain only letters, digits and underscores");
        }
        if (RESERVED_NAME.equals(name)) {
            throw new IllegalArgumentException("Agent name 'user' is reserved for end-user input");
        }
        return name;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<BaseAgent> subAgents() {
        return subAgents;
    }

    public BaseAgent parentAgent() {
        return parentAgent;
    }

    public List<BeforeAgentCallback> beforeAgentCallbacks() {
        return beforeAgentCallbacks;
    }

    public List<AfterAgentCallback> afterAgentCallbacks() {
        return afterAgentCallbacks;
    }

    public BaseAgent rootAgent() {
        BaseAgent agent = this;
        while (agent.parentAgent != null) {
            agent = agent.parentAgent;
        }
        return agent;
    }

    /** This agent or the descendant with the given name. */
    public Optional<BaseAgent> findAgent(String agentName) {
        return name.equals(agentName) ? Optional.of(this) : findSubAgent(agentName);
    }

    /** Depth-first search among descendants. */
    public Optional<BaseAgent> findSubAgent(String agentName) {
        for (BaseAgent child : subAgents) {
            Optional<BaseAgent> found = child.findAgent(agentName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Runs the agent: before-agent callbacks, {@link #runImpl}, after-agent callbacks.
     * Each phase is created only when the previous one is exhausted, and none starts
     * once the invocation has been ended.
     */
    public final EventStream run(InvocationContext parentContext) {
        InvocationContext ctx = parentContext.withAgent(this);
        var skipped = new AtomicBoolean();
        return EventStreams.concat(
                () -> beforeAgent(ctx, skipped),
                () -> {
                    if (skipped.get() || ctx.isEndInvocation()) {
                        return EventStreams.empty();
                    }
                    MdcContext.setAgent(name, ctx.branch());
                    log.debug("Running agent '{}' (branch {})", name, ctx.branch());
                    return runImpl(ctx);
                },
                () -> skipped.get() || ctx.isEndInvocation() ? EventStreams.empty() : afterAgent(ctx));
    }

    /**
     * The agent's own logic.
     *
     * @param ctx context whose {@code agent()} is this agent
     */
    protected abstract EventStream runImpl(InvocationContext ctx);

    protected Event.Builder eventBuilder(InvocationContext ctx) {
        return Event.builder()
                .invocationId(ctx.invocationId())
                .author(name)
                .branch(ctx.branch());
    }

    // ── Agent callbacks ──────────────────────────────────────────────────

    private EventStream beforeAgent(InvocationContext ctx, AtomicBoolean skipped) {
        if (beforeAgentCallbacks.isEmpty() || ctx.isEndInvocation()) {
            return EventStreams.empty();
        }
        MdcContext.setAgent(name, ctx.branch());
        var callbackContext = new CallbackContext(ctx);
        Optional<Content> override = CallbackChain.firstDecision("before_agent", beforeAgentCallbacks,
                cb -> cb.beforeAgent(callbackContext));
        if (override.isPresent()) {
            skipped.set(true);
            log.debug("Agent '{}' skipped by before-agent callback", name);
        }
        return callbackEvent(ctx, callbackContext, override);
    }

    private EventStream afterAgent(InvocationContext ctx) {
        if (afterAgentCallbacks.isEmpty()) {
            return EventStreams.empty();
        }
        var callbackContext = new CallbackContext(ctx);
        Optional<Content> extra = CallbackChain.firstDecision("after_agent", afterAgentCallbacks,
                cb -> cb.afterAgent(callbackContext));
        return callbackEvent(ctx, callbackContext, extra);
    }

    private EventStream callbackEvent(InvocationContext ctx, CallbackContext callbackContext,
                                      Optional<Content> content) {
        if (content.isEmpty() && callbackContext.actions().isEmpty()) {
            return EventStreams.empty();
        }
        return EventStreams.of(eventBuilder(ctx)
                .content(content.orElse(null))
                .actions(callbackContext.actions().build())
                .build());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
