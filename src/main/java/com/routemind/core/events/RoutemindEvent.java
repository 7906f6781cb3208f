package com.routemind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted while routing or executing workflows.
 *
 * @param eventType  event type (e.g. "workflow.started", "task.completed", "backend.status_changed")
 * @param workflowId the workflow this event belongs to (nullable for backend-level events)
 * @param taskId     the task this event relates to (nullable for workflow-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record RoutemindEvent(
    String eventType,
    String workflowId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static RoutemindEvent of(String eventType, String workflowId, String taskId, Map<String, Object> payload) {
        return new RoutemindEvent(eventType, workflowId, taskId, payload, Instant.now());
    }
}
