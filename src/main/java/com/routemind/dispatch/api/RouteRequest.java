package com.routemind.dispatch.api;

/**
 * Either a prompt to classify, or an explicit task type with an optional complexity
 * (classified from the prompt, or {@code simple}, when absent).
 */
public record RouteRequest(
    String prompt,
    String taskType,
    String complexity,
    Double budgetFactor
) {}
