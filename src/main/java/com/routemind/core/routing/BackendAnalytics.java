package com.routemind.core.routing;

import com.routemind.core.model.HealthState;

import java.util.List;

/**
 * Routing analytics snapshot.
 *
 * @param registrySize number of registered backends
 * @param backends     per-backend figures in registration order
 */
public record BackendAnalytics(int registrySize, List<BackendStats> backends) {

    /**
     * @param routedRequests        decisions that selected this backend
     * @param reportedOutcomes      execution outcomes reported for this backend
     * @param successRate           success share of the rolling window, 1.0 when empty
     * @param averageLatencySeconds cached rolling latency
     */
    public record BackendStats(
        String name,
        long routedRequests,
        long reportedOutcomes,
        double successRate,
        double averageLatencySeconds,
        HealthState health,
        int consecutiveFailures
    ) {}
}
