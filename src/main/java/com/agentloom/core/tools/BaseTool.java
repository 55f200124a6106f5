package com.agentloom.core.tools;

import java.util.Map;
import java.util.Objects;

/**
 * A capability the model can invoke through a function call.
 */
public abstract class BaseTool {

    private final String name;
    private final String description;

    protected BaseTool(String name, String description) {
        this.name = Objects.requireNonNull(name, "tool name must not be null");
        this.description = description == null ? "" : description;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    /**
     * Declaration sent to the model. Tools with arguments override this to add a schema.
     */
    public FunctionDeclaration declaration() {
        return new FunctionDeclaration(name, description, null);
    }

    /**
     * Executes the tool. State changes and control signals go through the context and are
     * committed with the function response event.
     *
     * @return the response object handed back to the model
     */
    public abstract Map<String, Object> run(Map<String, Object> args, ToolContext toolContext) throws Exception;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
