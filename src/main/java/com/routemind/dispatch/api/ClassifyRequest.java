package com.routemind.dispatch.api;

public record ClassifyRequest(String prompt) {}
