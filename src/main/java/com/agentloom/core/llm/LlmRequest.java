package com.agentloom.core.llm;

import com.agentloom.core.model.Content;
import com.agentloom.core.tools.BaseTool;
import com.agentloom.core.tools.FunctionDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything sent to the model for one step. Mutable so that before-model callbacks
 * can rewrite it in place.
 */
public class LlmRequest {

    private String model;
    private String systemInstruction;
    private final List<Content> contents = new ArrayList<>();
    private final Map<String, BaseTool> tools = new LinkedHashMap<>();

    public LlmRequest(String model) {
        this.model = model;
    }

    public String model() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String systemInstruction() {
        return systemInstruction;
    }

    public void setSystemInstruction(String systemInstruction) {
        this.systemInstruction = systemInstruction;
    }

    /** Appends text to the system instruction, separated by a blank line. */
    public void appendInstruction(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        systemInstruction = systemInstruction == null || systemInstruction.isBlank()
                ? text
                : systemInstruction + "\n\n" + text;
    }

    /** Live, ordered conversation history. */
    public List<Content> contents() {
        return contents;
    }

    public void addTool(BaseTool tool) {
        tools.put(tool.name(), tool);
    }

    public Map<String, BaseTool> tools() {
        return tools;
    }

    public Optional<BaseTool> tool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<FunctionDeclaration> toolDeclarations() {
        return tools.values().stream().map(BaseTool::declaration).toList();
    }
}
