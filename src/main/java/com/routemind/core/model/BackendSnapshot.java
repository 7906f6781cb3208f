package com.routemind.core.model;

/**
 * Consistent read view of one registry entry.
 */
public record BackendSnapshot(
    BackendDescriptor descriptor,
    BackendHealth health
) {

    public String name() {
        return descriptor.name();
    }

    public double averageLatencySeconds() {
        return health.averageLatencySeconds();
    }
}
