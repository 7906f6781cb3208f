package com.routemind.core.model;

/**
 * Execution state of a task within a workflow run.
 */
public enum TaskState {
    PENDING,
    READY,      // dependencies done, waiting for a worker
    RUNNING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
