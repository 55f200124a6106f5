package com.agentloom.core.callbacks;

import com.agentloom.core.tools.BaseTool;
import com.agentloom.core.tools.ToolContext;

import java.util.Map;
import java.util.Optional;

/**
 * Runs after a tool; returning a result replaces the tool's response.
 */
@FunctionalInterface
public interface AfterToolCallback {

    Optional<Map<String, Object>> afterTool(BaseTool tool, Map<String, Object> args, ToolContext context,
                                            Map<String, Object> response) throws Exception;
}
