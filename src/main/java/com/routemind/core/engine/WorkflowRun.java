package com.routemind.core.engine;

import com.routemind.core.execution.WorkflowResult;
import com.routemind.core.model.TaskState;
import com.routemind.core.model.WorkflowStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of a submitted workflow.
 *
 * @param taskStates current state per task id, in creation order
 * @param finishedAt null while the workflow is still running
 * @param result     final result, null while running
 */
public record WorkflowRun(
    String workflowId,
    String templateKey,
    String prompt,
    WorkflowStatus status,
    Map<String, TaskState> taskStates,
    Instant submittedAt,
    Instant finishedAt,
    WorkflowResult result
) {

    public boolean isFinished() {
        return status != WorkflowStatus.RUNNING;
    }
}
