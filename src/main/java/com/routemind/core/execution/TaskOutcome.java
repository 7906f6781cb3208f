package com.routemind.core.execution;

import com.routemind.core.model.TaskState;
import com.routemind.core.model.TaskType;

/**
 * Final result of one task.
 *
 * @param state         DONE or FAILED
 * @param backend       backend that produced the output, or the last one tried (nullable)
 * @param output        backend output when DONE
 * @param failureReason why the task failed, null when DONE
 * @param attempts      backend calls made for this task
 * @param durationMs    wall time from start to final state
 */
public record TaskOutcome(
    String taskId,
    TaskType type,
    TaskState state,
    String backend,
    String output,
    String failureReason,
    int attempts,
    long durationMs
) {

    public static TaskOutcome done(String taskId, TaskType type, String backend, String output,
                                   int attempts, long durationMs) {
        return new TaskOutcome(taskId, type, TaskState.DONE, backend, output, null, attempts, durationMs);
    }

    public static TaskOutcome failed(String taskId, TaskType type, String backend, String reason,
                                     int attempts, long durationMs) {
        return new TaskOutcome(taskId, type, TaskState.FAILED, backend, null, reason, attempts, durationMs);
    }

    public boolean succeeded() {
        return state == TaskState.DONE;
    }
}
