package com.routemind.core.model;

import java.util.List;

/**
 * Tasks built from a template, with the template that was actually used.
 *
 * @param templateKey resolved template key (inferred when none was requested)
 * @param tasks       tasks in creation order; dependencies only point backwards
 */
public record WorkflowPlan(String templateKey, List<Task> tasks) {

    public WorkflowPlan {
        tasks = List.copyOf(tasks);
    }

    public long parallelGroupCount() {
        return tasks.stream().map(Task::parallelGroup).filter(g -> g != null).distinct().count();
    }
}
