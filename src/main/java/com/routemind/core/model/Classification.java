package com.routemind.core.model;

/**
 * Result of classifying a prompt.
 *
 * @param complexity estimated difficulty
 * @param taskType   dominant domain
 * @param defaulted  true when no pattern or keyword matched and the safe default was used
 */
public record Classification(
    ComplexityLevel complexity,
    TaskType taskType,
    boolean defaulted
) {

    public static Classification fallback() {
        return new Classification(ComplexityLevel.SIMPLE, TaskType.GENERAL, true);
    }
}
