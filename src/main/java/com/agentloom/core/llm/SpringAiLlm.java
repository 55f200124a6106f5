package com.agentloom.core.llm;

import com.agentloom.core.model.Content;
import com.agentloom.core.model.Part;
import com.agentloom.core.tools.FunctionDeclaration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link BaseLlm} backed by a Spring AI {@link ChatClient}.
 * <p>
 * Tools are only declared to the provider; Spring AI's internal tool execution is
 * switched off so that function calls come back to the agent, which runs them through
 * its own callback chain and commits the results as events.
 */
public class SpringAiLlm extends BaseLlm {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlm.class);

    static final String EMPTY_RESPONSE = "EMPTY_RESPONSE";
    static final String MALFORMED_FUNCTION_CALL = "MALFORMED_FUNCTION_CALL";

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SpringAiLlm(String model, ChatClient chatClient) {
        super(model);
        this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
    }

    public SpringAiLlm(String model, ChatClient.Builder builder) {
        this(model, builder.build());
    }

    @Override
    public Stream<LlmResponse> generateContent(LlmRequest request, boolean stream) {
        var spec = chatClient.prompt();
        if (request.systemInstruction() != null && !request.systemInstruction().isBlank()) {
            spec = spec.system(request.systemInstruction());
        }
        spec = spec.messages(toMessages(request.contents()));
        if (!request.tools().isEmpty()) {
            List<ToolCallback> declarations = request.toolDeclarations().stream()
                    .map(this::toToolCallback)
                    .toList();
            spec = spec.options(ToolCallingChatOptions.builder()
                    .toolCallbacks(declarations)
                    .internalToolExecutionEnabled(false)
                    .build());
        }

        if (!stream) {
            long start = System.currentTimeMillis();
            ChatResponse response = spec.call().chatResponse();
            log.info("Model {} responded in {}s", model(),
                    String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
            return Stream.of(toFinalResponse(response == null || response.getResult() == null
                    ? null : response.getResult().getOutput()));
        }

        var text = new StringBuilder();
        var toolCalls = new ArrayList<AssistantMessage.ToolCall>();
        Stream<LlmResponse> partials = spec.stream().chatResponse().toStream()
                .filter(chunk -> chunk.getResult() != null && chunk.getResult().getOutput() != null)
                .map(chunk -> chunk.getResult().getOutput())
                .peek(output -> {
                    if (output.hasToolCalls()) {
                        toolCalls.addAll(output.getToolCalls());
                    }
                })
                .map(AssistantMessage::getText)
                .filter(chunkText -> chunkText != null && !chunkText.isEmpty())
                .peek(text::append)
                .map(LlmResponse::partialText);
        Stream<LlmResponse> last = Stream.of(Boolean.TRUE)
                .map(ignored -> toFinalResponse(new AssistantMessage(text.toString(), Map.of(), toolCalls)));
        return Stream.concat(partials, last);
    }

    // ── Request mapping ──────────────────────────────────────────────────

    List<Message> toMessages(List<Content> contents) {
        var messages = new ArrayList<Message>();
        for (Content content : contents) {
            if (Content.ROLE_MODEL.equals(content.role())) {
                var calls = content.functionCalls().stream()
                        .map(call -> new AssistantMessage.ToolCall(call.id(), "function", call.name(), toJson(call.args())))
                        .toList();
                messages.add(new AssistantMessage(content.text(), Map.of(), calls));
            } else if (!content.functionResponses().isEmpty()) {
                var responses = content.functionResponses().stream()
                        .map(r -> new ToolResponseMessage.ToolResponse(r.id(), r.name(), toJson(r.response())))
                        .toList();
                messages.add(new ToolResponseMessage(responses));
            } else {
                String text = content.parts().stream()
                        .map(Part::text)
                        .filter(Objects::nonNull)
                        .collect(Collectors.joining("\n"));
                messages.add(new UserMessage(text));
            }
        }
        return messages;
    }

    private ToolCallback toToolCallback(FunctionDeclaration declaration) {
        Map<String, Object> schema = declaration.parameters() != null
                ? declaration.parameters()
                : Map.of("type", "object", "properties", Map.of());
        var definition = ToolDefinition.builder()
                .name(declaration.name())
                .description(declaration.description())
                .inputSchema(toJson(schema))
                .build();
        return new DeclaredToolCallback(definition);
    }

    // ── Response mapping ─────────────────────────────────────────────────

    LlmResponse toFinalResponse(AssistantMessage output) {
        if (output == null || ((output.getText() == null || output.getText().isBlank()) && !output.hasToolCalls())) {
            return LlmResponse.error(EMPTY_RESPONSE, "Model " + model() + " returned no content");
        }
        var parts = new ArrayList<Part>();
        if (output.getText() != null && !output.getText().isEmpty()) {
            parts.add(Part.fromText(output.getText()));
        }
        for (AssistantMessage.ToolCall call : output.getToolCalls()) {
            try {
                parts.add(Part.fromFunctionCall(call.id(), call.name(), fromJson(call.arguments())));
            } catch (JsonProcessingException e) {
                log.warn("Model {} sent unparseable arguments for tool '{}': {}", model(), call.name(), e.getMessage());
                return LlmResponse.error(MALFORMED_FUNCTION_CALL,
                        "Arguments of call to '" + call.name() + "' are not a JSON object: " + e.getOriginalMessage());
            }
        }
        return LlmResponse.of(new Content(Content.ROLE_MODEL, parts));
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool payload", e);
        }
    }

    private Map<String, Object> fromJson(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
    }

    /**
     * Declares a tool to the provider. Never executed, since internal tool execution is disabled.
     */
    private record DeclaredToolCallback(ToolDefinition definition) implements ToolCallback {

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException("Tool '" + definition.name()
                    + "' is executed by the agent, not by the chat client");
        }
    }
}
