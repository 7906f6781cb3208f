package com.routemind.core.model;

import java.util.Locale;

/**
 * Domain of a job or subtask. The classifier emits REASONING, CODING, CREATIVE,
 * RESEARCH and GENERAL; workflow templates may also use ANALYSIS and MULTIMODAL.
 */
public enum TaskType {
    REASONING,
    CODING,
    CREATIVE,
    RESEARCH,
    ANALYSIS,
    MULTIMODAL,
    GENERAL;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a tag such as {@code "coding"}. {@code "advanced"} is accepted as an
     * alias of RESEARCH.
     *
     * @throws IllegalArgumentException for blank or unknown tags
     */
    public static TaskType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Task type must not be blank");
        }
        String normalized = tag.trim();
        if ("advanced".equalsIgnoreCase(normalized)) {
            return RESEARCH;
        }
        for (var type : values()) {
            if (type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + tag);
    }
}
