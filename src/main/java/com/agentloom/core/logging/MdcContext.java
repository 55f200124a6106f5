package com.agentloom.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Agentloom-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String INVOCATION_ID = "invocationId";
    public static final String AGENT = "agent";
    public static final String BRANCH = "branch";

    private MdcContext() {}

    public static void setInvocation(String sessionId, String invocationId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(INVOCATION_ID, invocationId);
    }

    public static void setAgent(String agentName, String branch) {
        MDC.put(AGENT, agentName);
        if (branch != null) {
            MDC.put(BRANCH, branch);
        } else {
            MDC.remove(BRANCH);
        }
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(INVOCATION_ID);
        MDC.remove(AGENT);
        MDC.remove(BRANCH);
    }
}
