package com.agentloom.core.tools;

import java.util.Map;

/**
 * How a tool is described to the model.
 *
 * @param name        tool name the model uses in function calls
 * @param description what the tool does
 * @param parameters  JSON schema of the arguments object (nullable when the tool takes none)
 */
public record FunctionDeclaration(String name, String description, Map<String, Object> parameters) {

    public FunctionDeclaration {
        parameters = parameters == null ? null : Map.copyOf(parameters);
    }
}
