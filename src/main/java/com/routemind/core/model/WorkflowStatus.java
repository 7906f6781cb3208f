package com.routemind.core.model;

/**
 * Status of a workflow run. RUNNING is the only non-final value.
 */
public enum WorkflowStatus {
    RUNNING,
    COMPLETED,  // every task DONE
    PARTIAL,    // some tasks DONE, some FAILED
    FAILED,     // no task DONE
    CANCELLED
}
