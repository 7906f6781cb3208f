package com.routemind.core.execution;

import java.time.Duration;

/**
 * Tunables of {@link TaskGraphExecutor}.
 *
 * @param maxParallel       worker threads running tasks
 * @param maxAttempts       backend calls allowed per task
 * @param timeoutMultiplier applied to the backend's cached average latency
 * @param minTimeout        lower bound of the per-attempt timeout
 * @param maxTimeout        upper bound of the per-attempt timeout
 */
public record ExecutionSettings(
    int maxParallel,
    int maxAttempts,
    double timeoutMultiplier,
    Duration minTimeout,
    Duration maxTimeout
) {

    public ExecutionSettings {
        if (maxParallel < 1) throw new IllegalArgumentException("maxParallel must be >= 1");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (minTimeout.compareTo(maxTimeout) > 0) {
            throw new IllegalArgumentException("minTimeout must not exceed maxTimeout");
        }
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(4, 3, 3.0, Duration.ofSeconds(5), Duration.ofSeconds(120));
    }

    /**
     * {@code max(minTimeout, averageLatency * multiplier)}, capped at {@code maxTimeout}.
     */
    public Duration attemptTimeout(double averageLatencySeconds) {
        long scaledMs = (long) Math.ceil(averageLatencySeconds * timeoutMultiplier * 1000.0);
        long ms = Math.max(minTimeout.toMillis(), scaledMs);
        return Duration.ofMillis(Math.min(ms, maxTimeout.toMillis()));
    }
}
