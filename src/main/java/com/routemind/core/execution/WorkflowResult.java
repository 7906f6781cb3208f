package com.routemind.core.execution;

import com.routemind.core.model.TaskState;
import com.routemind.core.model.WorkflowStatus;

import java.util.List;
import java.util.Map;

/**
 * Outcome of executing a task graph.
 *
 * @param taskStates final state per task id, in creation order
 * @param outputs    output per DONE task id
 * @param failures   every FAILED task with its reason, in the order they failed
 */
public record WorkflowResult(
    String workflowId,
    WorkflowStatus status,
    Map<String, TaskState> taskStates,
    Map<String, String> outputs,
    List<TaskFailure> failures,
    long durationMs
) {

    public record TaskFailure(String taskId, String reason) {}

    public WorkflowResult {
        failures = List.copyOf(failures);
    }
}
