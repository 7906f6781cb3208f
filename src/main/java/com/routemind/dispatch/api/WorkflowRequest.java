package com.routemind.dispatch.api;

import java.util.Map;

/**
 * @param template template key, or null to infer one from the prompt
 */
public record WorkflowRequest(
    String prompt,
    String template,
    Map<String, Object> context
) {}
