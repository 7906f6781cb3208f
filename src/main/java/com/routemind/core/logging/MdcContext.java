package com.routemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Routemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put("workflowId", workflowId);
    }

    public static void setTask(String workflowId, String taskId) {
        MDC.put("workflowId", workflowId);
        MDC.put("taskId", taskId);
    }

    public static void setBackend(String backend) {
        MDC.put("backend", backend);
    }

    public static void clearBackend() {
        MDC.remove("backend");
    }

    public static void clear() {
        MDC.remove("workflowId");
        MDC.remove("taskId");
        MDC.remove("backend");
    }
}
