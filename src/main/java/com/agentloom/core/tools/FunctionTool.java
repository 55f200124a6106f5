package com.agentloom.core.tools;

import java.util.Map;
import java.util.Objects;

/**
 * Tool backed by a lambda.
 */
public class FunctionTool extends BaseTool {

    /**
     * Tool body.
     */
    @FunctionalInterface
    public interface ToolFunction {
        Map<String, Object> apply(Map<String, Object> args, ToolContext toolContext) throws Exception;
    }

    private final Map<String, Object> parameters;
    private final ToolFunction function;

    public FunctionTool(String name, String description, Map<String, Object> parameters, ToolFunction function) {
        super(name, description);
        this.parameters = parameters;
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    public static FunctionTool of(String name, String description, ToolFunction function) {
        return new FunctionTool(name, description, null, function);
    }

    public static FunctionTool of(String name, String description, Map<String, Object> parameters,
                                  ToolFunction function) {
        return new FunctionTool(name, description, parameters, function);
    }

    @Override
    public FunctionDeclaration declaration() {
        return new FunctionDeclaration(name(), description(), parameters);
    }

    @Override
    public Map<String, Object> run(Map<String, Object> args, ToolContext toolContext) throws Exception {
        Map<String, Object> result = function.apply(args, toolContext);
        return result == null ? Map.of() : result;
    }
}
