package com.routemind.core.logging;

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
    @DisplayName("setWorkflow puts workflowId in MDC")
    void setWorkflow() {
        MdcContext.setWorkflow("WF-2026-0001");
        assertEquals("WF-2026-0001", MDC.get("workflowId"));
    }

    @Test
    @DisplayName("setTask puts workflowId and taskId in MDC")
    void setTask() {
        MdcContext.setTask("WF-2026-0001", "3f2a9c1b-coding-1");
        assertEquals("WF-2026-0001", MDC.get("workflowId"));
        assertEquals("3f2a9c1b-coding-1", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clearBackend removes only the backend key")
    void clearBackend() {
        MdcContext.setTask("WF-2026-0001", "t1");
        MdcContext.setBackend("coding");
        assertEquals("coding", MDC.get("backend"));
        MdcContext.clearBackend();
        assertNull(MDC.get("backend"));
        assertEquals("t1", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clear removes all keys")
    void clear() {
        MdcContext.setTask("WF-2026-0001", "t1");
        MdcContext.setBackend("coding");
        MdcContext.clear();
        assertNull(MDC.get("workflowId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("backend"));
    }
}
