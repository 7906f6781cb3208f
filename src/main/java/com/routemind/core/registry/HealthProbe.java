package com.routemind.core.registry;

import com.routemind.core.model.BackendDescriptor;

import java.time.Duration;

/**
 * Checks liveness of a single backend. Implementations must not throw;
 * every failure is reported as a down {@link ProbeResult}.
 */
@FunctionalInterface
public interface HealthProbe {

    ProbeResult probe(BackendDescriptor backend, Duration timeout);
}
