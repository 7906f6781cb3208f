package com.routemind.core.model;

import java.util.List;
import java.util.Map;

/**
 * Declarative collaboration pattern expanded by the workflow builder.
 *
 * @param key                      lookup name (e.g. "code_development")
 * @param name                     display name
 * @param description              what the workflow achieves
 * @param taskTypes                ordered task-type sequence
 * @param dependencies             task type to prerequisite task types
 * @param parallelSections         partitions of mutually independent task types
 * @param requiredCapabilities     capabilities the workflow needs from the registry
 * @param keywords                 prompt keywords used to infer this template
 * @param estimatedDurationSeconds rough duration hint
 */
public record WorkflowTemplate(
    String key,
    String name,
    String description,
    List<TaskType> taskTypes,
    Map<TaskType, List<TaskType>> dependencies,
    List<List<TaskType>> parallelSections,
    List<String> requiredCapabilities,
    List<String> keywords,
    int estimatedDurationSeconds
) {

    public WorkflowTemplate {
        taskTypes = taskTypes == null ? List.of() : List.copyOf(taskTypes);
        dependencies = dependencies == null ? Map.of() : Map.copyOf(dependencies);
        parallelSections = parallelSections == null ? List.of()
                : parallelSections.stream().map(List::copyOf).toList();
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        name = name == null || name.isBlank() ? key : name;
        description = description == null ? "" : description;
    }

    public List<TaskType> prerequisitesOf(TaskType type) {
        return dependencies.getOrDefault(type, List.of());
    }
}
