package com.routemind.core.model;

import java.util.Locale;

/**
 * Ordinal difficulty of a job. Declaration order is the ordering used for
 * capability-ceiling comparisons: SIMPLE &lt; MODERATE &lt; COMPLEX &lt; EXPERT.
 */
public enum ComplexityLevel {
    SIMPLE,
    MODERATE,
    COMPLEX,
    EXPERT;

    /**
     * True when a backend with this ceiling can take work of the required level.
     */
    public boolean meets(ComplexityLevel required) {
        return this.ordinal() >= required.ordinal();
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configuration tag such as {@code "expert"}.
     *
     * @throws IllegalArgumentException for blank or unknown tags
     */
    public static ComplexityLevel fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Complexity level must not be blank");
        }
        for (var level : values()) {
            if (level.name().equalsIgnoreCase(tag.trim())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown complexity level: " + tag);
    }
}
