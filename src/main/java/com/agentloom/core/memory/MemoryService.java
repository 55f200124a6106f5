package com.agentloom.core.memory;

/**
 * Long-term knowledge a tool can query across sessions.
 */
public interface MemoryService {

    SearchMemoryResponse searchMemory(String appName, String userId, String query);
}
