package com.routemind.core.execution;

/**
 * Callback receiving every task outcome as soon as the task reaches a final state,
 * including tasks failed by dependency propagation or cancellation.
 */
@FunctionalInterface
public interface TaskResultListener {

    TaskResultListener NONE = (workflowId, outcome) -> { };

    void onTaskResult(String workflowId, TaskOutcome outcome);
}
