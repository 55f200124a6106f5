package com.agentloom.core.callbacks;

import com.agentloom.core.tools.BaseTool;
import com.agentloom.core.tools.ToolContext;

import java.util.Map;
import java.util.Optional;

/**
 * Runs before a tool; may edit the arguments in place. Returning a result skips the tool.
 */
@FunctionalInterface
public interface BeforeToolCallback {

    Optional<Map<String, Object>> beforeTool(BaseTool tool, Map<String, Object> args, ToolContext context)
            throws Exception;
}
