package com.agentloom.core.tools;

import java.util.Map;

/**
 * Lets the model end the enclosing loop agent: the function response event carries
 * {@code escalate=true}.
 */
public class ExitLoopTool extends BaseTool {

    public static final String NAME = "exit_loop";

    public ExitLoopTool() {
        super(NAME, "Exits the loop. Call this function only when you are instructed to do so.");
    }

    @Override
    public Map<String, Object> run(Map<String, Object> args, ToolContext toolContext) {
        toolContext.actions().escalate(true).skipSummarization(true);
        return Map.of();
    }
}
