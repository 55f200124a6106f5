package com.agentloom.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setInvocation puts sessionId and invocationId in MDC")
    void setInvocation() {
        MdcContext.setInvocation("s-1", "e-42");
        assertEquals("s-1", MDC.get("sessionId"));
        assertEquals("e-42", MDC.get("invocationId"));
    }

    @Test
    @DisplayName("setAgent puts agent and branch in MDC")
    void setAgent() {
        MdcContext.setAgent("summarizer", "pipeline.summarizer");
        assertEquals("summarizer", MDC.get("agent"));
        assertEquals("pipeline.summarizer", MDC.get("branch"));
    }

    @Test
    @DisplayName("setAgent without branch removes a stale branch")
    void setAgentWithoutBranch() {
        MdcContext.setAgent("a", "fanout.a");
        MdcContext.setAgent("root", null);
        assertEquals("root", MDC.get("agent"));
        assertNull(MDC.get("branch"));
    }

    @Test
    @DisplayName("clear removes all agentloom MDC keys")
    void clear() {
        MdcContext.setInvocation("s-1", "e-42");
        MdcContext.setAgent("a", "fanout.a");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("invocationId"));
        assertNull(MDC.get("agent"));
        assertNull(MDC.get("branch"));
    }
}
