package com.routemind.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single subtask of a workflow.
 *
 * @param id            unique identifier (e.g. "3f2a9c1b-coding-1")
 * @param type          domain used for routing
 * @param prompt        type-specific sub-prompt
 * @param context       caller-supplied context, copied per task
 * @param dependencies  ids of earlier tasks that must be DONE first
 * @param parallelGroup shared id of tasks released together, or null
 * @param state         current execution state
 */
public record Task(
    String id,
    TaskType type,
    String prompt,
    Map<String, Object> context,
    List<String> dependencies,
    String parallelGroup,
    TaskState state
) {

    public Task {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        state = state == null ? TaskState.PENDING : state;
    }

    public Task withState(TaskState newState) {
        return new Task(id, type, prompt, context, dependencies, parallelGroup, newState);
    }
}
