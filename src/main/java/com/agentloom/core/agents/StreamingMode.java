package com.agentloom.core.agents;

public enum StreamingMode {
    /** Only final model responses become events. */
    NONE,
    /** Partial model responses are forwarded as partial events before the final one. */
    SSE
}
