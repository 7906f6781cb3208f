package com.routemind.core.execution;

import com.routemind.core.model.BackendDescriptor;

import java.time.Duration;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * One call to a backend.
 *
 * @param backend   target backend
 * @param prompt    task prompt
 * @param context   task context including {@code dependency.<taskId>} outputs
 * @param timeout   per-attempt timeout
 * @param cancelled checkpoint for cooperative cancellation; long-running invokers should poll it
 */
public record InvocationRequest(
    BackendDescriptor backend,
    String prompt,
    Map<String, Object> context,
    Duration timeout,
    BooleanSupplier cancelled
) {

    public InvocationRequest {
        context = context == null ? Map.of() : context;
        cancelled = cancelled == null ? () -> false : cancelled;
    }
}
