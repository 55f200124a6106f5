package com.agentloom.core.agents;

import com.agentloom.core.callbacks.AfterAgentCallback;
import com.agentloom.core.callbacks.AfterModelCallback;
import com.agentloom.core.callbacks.AfterToolCallback;
import com.agentloom.core.callbacks.BeforeAgentCallback;
import com.agentloom.core.callbacks.BeforeModelCallback;
import com.agentloom.core.callbacks.BeforeToolCallback;
import com.agentloom.core.callbacks.CallbackChain;
import com.agentloom.core.llm.BaseLlm;
import com.agentloom.core.llm.LlmRequest;
import com.agentloom.core.llm.LlmResponse;
import com.agentloom.core.model.Content;
import com.agentloom.core.model.Event;
import com.agentloom.core.model.EventActions;
import com.agentloom.core.model.FunctionCall;
import com.agentloom.core.model.FunctionResponse;
import com.agentloom.core.model.Part;
import com.agentloom.core.session.StateScope;
import com.agentloom.core.stream.Emitter;
import com.agentloom.core.stream.EventStream;
import com.agentloom.core.stream.EventStreams;
import com.agentloom.core.tools.BaseTool;
import com.agentloom.core.tools.ToolContext;
import com.agentloom.core.tools.ToolExecutionException;
import com.agentloom.core.tools.ToolNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Leaf agent driven by a reasoning model.
 * <p>
 * Each step sends the branch-visible conversation, the resolved instruction and the tool
 * declarations to the model and emits the answer as an event. When the answer holds
 * function calls, the tools run and their results are emitted as one function response
 * event, after which the next step starts. The agent finishes on the first answer
 * without function calls, on a model error, or when a tool escalates or asks to skip
 * summarisation.
 * <p>
 * An LlmAgent never has sub-agents; compose it under a workflow agent instead.
 */
public final class LlmAgent extends BaseAgent {

    private static final Logger log = LoggerFactory.getLogger(LlmAgent.class);

    /** Which session history the model sees. */
    public enum IncludeContents {
        /** All branch-visible events of the session. */
        DEFAULT,
        /** Only the current user input and this agent's own events of the current invocation. */
        NONE
    }

    private final BaseLlm model;
    private final String instruction;
    private final Map<String, BaseTool> tools;
    private final String outputKey;
    private final IncludeContents includeContents;
    private final List<BeforeModelCallback> beforeModelCallbacks;
    private final List<AfterModelCallback> afterModelCallbacks;
    private final List<BeforeToolCallback> beforeToolCallbacks;
    private final List<AfterToolCallback> afterToolCallbacks;

    private LlmAgent(Builder b) {
        super(b.name, b.description, List.of(), b.beforeAgentCallbacks, b.afterAgentCallbacks);
        this.model = Objects.requireNonNull(b.model, "model must not be null");
        this.instruction = b.instruction;
        this.outputKey = b.outputKey;
        this.includeContents = b.includeContents;
        this.beforeModelCallbacks = List.copyOf(b.beforeModelCallbacks);
        this.afterModelCallbacks = List.copyOf(b.afterModelCallbacks);
        this.beforeToolCallbacks = List.copyOf(b.beforeToolCallbacks);
        this.afterToolCallbacks = List.copyOf(b.afterToolCallbacks);

        var byName = new LinkedHashMap<String, BaseTool>();
        for (BaseTool tool : b.tools) {
            if (byName.put(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Agent '" + b.name + "' has two tools named '" + tool.name() + "'");
            }
        }
        this.tools = byName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public BaseLlm model() {
        return model;
    }

    public String instruction() {
        return instruction;
    }

    public List<BaseTool> tools() {
        return List.copyOf(tools.values());
    }

    public String outputKey() {
        return outputKey;
    }

    public IncludeContents includeContents() {
        return includeContents;
    }

    @Override
    protected EventStream runImpl(InvocationContext ctx) {
        return EventStreams.generate(ctx.executor(), emitter -> {
            while (!ctx.isEndInvocation()) {
                Event last = runStep(ctx, emitter);
                if (last == null || last.isError() || last.functionResponses().isEmpty()) {
                    return;
                }
                if (last.actions().escalate() || last.actions().skipSummarization()) {
                    return;
                }
            }
        });
    }

    /**
     * One model round trip, plus tool execution when the model asked for it.
     *
     * @return the last event emitted, null when nothing final was produced
     */
    private Event runStep(InvocationContext ctx, Emitter emitter) {
        LlmRequest request = buildRequest(ctx);
        var callbackContext = new CallbackContext(ctx);

        Optional<LlmResponse> replacement = CallbackChain.firstDecision("before_model", beforeModelCallbacks,
                cb -> cb.beforeModel(callbackContext, request));

        Event finalEvent = null;
        CallbackContext responseContext = callbackContext;
        if (replacement.isPresent()) {
            log.debug("Model call of agent '{}' replaced by before-model callback", name());
            finalEvent = finalEvent(ctx, callbackContext, replacement.get());
            emitter.emit(finalEvent);
        } else {
            ctx.incrementLlmCallCount();
            boolean streaming = ctx.runConfig().streamingMode() == StreamingMode.SSE;
            log.debug("Calling model {} for agent '{}' ({} contents, {} tools)",
                    model.model(), name(), request.contents().size(), request.tools().size());
            try (Stream<LlmResponse> responses = model.generateContent(request, streaming)) {
                var it = responses.iterator();
                while (it.hasNext()) {
                    LlmResponse response = it.next();
                    if (response.partial()) {
                        if (streaming) {
                            emitter.emit(eventBuilder(ctx)
                                    .content(response.content())
                                    .partial(true)
                                    .build());
                        }
                        continue;
                    }
                    CallbackContext afterContext = responseContext;
                    LlmResponse effective = CallbackChain.firstDecision("after_model", afterModelCallbacks,
                                    cb -> cb.afterModel(afterContext, response))
                            .orElse(response);
                    finalEvent = finalEvent(ctx, afterContext, effective);
                    emitter.emit(finalEvent);
                    // pending actions travel with the first final response only
                    responseContext = new CallbackContext(ctx);
                }
            }
        }

        if (finalEvent == null || finalEvent.isError() || finalEvent.functionCalls().isEmpty()) {
            return finalEvent;
        }
        if (ctx.isEndInvocation()) {
            return null;
        }
        Event toolEvent = runTools(ctx, finalEvent.functionCalls());
        emitter.emit(toolEvent);
        return toolEvent;
    }

    private Event finalEvent(InvocationContext ctx, CallbackContext callbackContext, LlmResponse response) {
        EventActions.Builder actions = callbackContext.actions();
        Content content = response.content();
        if (outputKey != null && !response.isError() && content != null
                && content.functionCalls().isEmpty() && !content.text().isBlank()) {
            actions.putState(outputKey, content.text());
        }
        return eventBuilder(ctx)
                .content(content)
                .actions(actions.build())
                .turnComplete(response.turnComplete())
                .errorCode(response.errorCode())
                .errorMessage(response.errorMessage())
                .build();
    }

    // ── Tools ────────────────────────────────────────────────────────────

    private Event runTools(InvocationContext ctx, List<FunctionCall> calls) {
        var parts = new ArrayList<Part>();
        var allActions = new ArrayList<EventActions>();
        for (FunctionCall call : calls) {
            BaseTool tool = tools.get(call.name());
            if (tool == null) {
                throw new ToolNotFoundException(name(), call.name());
            }
            var toolActions = EventActions.builder();
            var toolContext = new ToolContext(ctx, toolActions, call.id());
            Map<String, Object> args = new LinkedHashMap<>(call.args());

            Map<String, Object> response = CallbackChain.firstDecision("before_tool", beforeToolCallbacks,
                            cb -> cb.beforeTool(tool, args, toolContext))
                    .orElse(null);
            if (response == null) {
                response = invokeTool(tool, args, toolContext);
            }
            Map<String, Object> toolResponse = response;
            response = CallbackChain.firstDecision("after_tool", afterToolCallbacks,
                            cb -> cb.afterTool(tool, args, toolContext, toolResponse))
                    .orElse(toolResponse);

            log.debug("Tool '{}' of agent '{}' returned {} keys", tool.name(), name(), response.size());
            parts.add(Part.fromFunctionResponse(call.id(), call.name(), response));
            allActions.add(toolActions.build());
        }
        return eventBuilder(ctx)
                .content(new Content(Content.ROLE_USER, parts))
                .actions(EventActions.merge(allActions))
                .build();
    }

    private static Map<String, Object> invokeTool(BaseTool tool, Map<String, Object> args, ToolContext toolContext) {
        try {
            Map<String, Object> result = tool.run(args, toolContext);
            return result == null ? Map.of() : result;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ToolExecutionException(tool.name(), e);
        }
    }

    // ── Request building ─────────────────────────────────────────────────

    private LlmRequest buildRequest(InvocationContext ctx) {
        var request = new LlmRequest(model.model());
        request.setSystemInstruction(InstructionTemplate.resolve(name(), instruction, ctx.session().state()));
        tools.values().forEach(request::addTool);

        if (includeContents == IncludeContents.NONE) {
            if (ctx.userContent() != null) {
                request.contents().add(ctx.userContent());
            }
            for (Event event : ctx.session().events()) {
                if (ctx.invocationId().equals(event.invocationId()) && name().equals(event.author())
                        && hasContent(event) && isVisible(event, ctx.branch())) {
                    request.contents().add(event.content());
                }
            }
            return request;
        }

        for (Event event : ctx.session().events()) {
            if (!hasContent(event) || !isVisible(event, ctx.branch())) {
                continue;
            }
            if (isUser(event) || name().equals(event.author())) {
                request.contents().add(event.content());
            } else {
                request.contents().add(asForeignContext(event));
            }
        }
        return request;
    }

    private static boolean hasContent(Event event) {
        return !event.partial() && event.content() != null && !event.content().isEmpty();
    }

    private static boolean isUser(Event event) {
        return Content.ROLE_USER.equals(event.author());
    }

    /**
     * An event is visible on a branch when it was produced at top level, on the same
     * branch or on one of its ancestors.
     */
    static boolean isVisible(Event event, String currentBranch) {
        String eventBranch = event.branch();
        if (eventBranch == null || currentBranch == null) {
            return true;
        }
        return currentBranch.equals(eventBranch) || currentBranch.startsWith(eventBranch + ".");
    }

    /**
     * Rewrites another agent's turn as user-role context so the model does not take it
     * for its own output.
     */
    private static Content asForeignContext(Event event) {
        var parts = new ArrayList<Part>();
        parts.add(Part.fromText("For context:"));
        for (Part part : event.content().parts()) {
            if (part.text() != null && !part.text().isBlank()) {
                parts.add(Part.fromText("[" + event.author() + "] said: " + part.text()));
            } else if (part.functionCall() != null) {
                FunctionCall call = part.functionCall();
                parts.add(Part.fromText("[" + event.author() + "] called tool `" + call.name()
                        + "` with parameters: " + call.args()));
            } else if (part.functionResponse() != null) {
                FunctionResponse response = part.functionResponse();
                parts.add(Part.fromText("[" + event.author() + "] `" + response.name()
                        + "` tool returned result: " + response.response()));
            }
        }
        return new Content(Content.ROLE_USER, parts);
    }

    public static final class Builder {

        private String name;
        private String description = "";
        private BaseLlm model;
        private String instruction;
        private String outputKey;
        private IncludeContents includeContents = IncludeContents.DEFAULT;
        private final List<BaseTool> tools = new ArrayList<>();
        private final List<BeforeAgentCallback> beforeAgentCallbacks = new ArrayList<>();
        private final List<AfterAgentCallback> afterAgentCallbacks = new ArrayList<>();
        private final List<BeforeModelCallback> beforeModelCallbacks = new ArrayList<>();
        private final List<AfterModelCallback> afterModelCallbacks = new ArrayList<>();
        private final List<BeforeToolCallback> beforeToolCallbacks = new ArrayList<>();
        private final List<AfterToolCallback> afterToolCallbacks = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder model(BaseLlm model) {
            this.model = model;
            return this;
        }

        public Builder instruction(String instruction) {
            this.instruction = instruction;
            return this;
        }

        public Builder outputKey(String outputKey) {
            this.outputKey = outputKey;
            return this;
        }

        public Builder includeContents(IncludeContents includeContents) {
            this.includeContents = includeContents;
            return this;
        }

        public Builder tools(BaseTool... tools) {
            this.tools.addAll(List.of(tools));
            return this;
        }

        public Builder beforeAgentCallback(BeforeAgentCallback callback) {
            this.beforeAgentCallbacks.add(callback);
            return this;
        }

        public Builder afterAgentCallback(AfterAgentCallback callback) {
            this.afterAgentCallbacks.add(callback);
            return this;
        }

        public Builder beforeModelCallback(BeforeModelCallback callback) {
            this.beforeModelCallbacks.add(callback);
            return this;
        }

        public Builder afterModelCallback(AfterModelCallback callback) {
            this.afterModelCallbacks.add(callback);
            return this;
        }

        public Builder beforeToolCallback(BeforeToolCallback callback) {
            this.beforeToolCallbacks.add(callback);
            return this;
        }

        public Builder afterToolCallback(AfterToolCallback callback) {
            this.afterToolCallbacks.add(callback);
            return this;
        }

        public LlmAgent build() {
            if (outputKey != null) {
                StateScope.of(outputKey);
            }
            return new LlmAgent(this);
        }
    }
}
