package com.routemind.dispatch.api;

public record OutcomeRequest(
    String backend,
    Double latencySeconds,
    Boolean success
) {}
