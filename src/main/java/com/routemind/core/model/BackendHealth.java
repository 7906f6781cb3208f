package com.routemind.core.model;

import java.time.Instant;

/**
 * Immutable snapshot of the mutable part of a backend: health as seen by the
 * monitor plus the cached average latency fed by execution reports. The registry
 * swaps whole snapshots, so readers never observe a half-applied update.
 *
 * @param status                last known liveness
 * @param lastChecked           time of the last probe, null before the first one
 * @param consecutiveFailures   failed probes since the last success
 * @param averageLatencySeconds cached rolling latency used for scoring and timeouts
 * @param lastProbeDetail       endpoint that answered, or the last failure reason
 */
public record BackendHealth(
    HealthState status,
    Instant lastChecked,
    int consecutiveFailures,
    double averageLatencySeconds,
    String lastProbeDetail
) {

    public static BackendHealth unknown(double seedLatencySeconds) {
        return new BackendHealth(HealthState.UNKNOWN, null, 0, seedLatencySeconds, "not probed yet");
    }

    public BackendHealth afterProbeSuccess(Instant at, String detail) {
        return new BackendHealth(HealthState.ONLINE, at, 0, averageLatencySeconds, detail);
    }

    /**
     * Applies one failed probe. The backend goes OFFLINE once {@code failureThreshold}
     * consecutive failures have been observed and is DEGRADED before that.
     */
    public BackendHealth afterProbeFailure(Instant at, int failureThreshold, String detail) {
        int failures = consecutiveFailures + 1;
        HealthState next = failures >= failureThreshold ? HealthState.OFFLINE : HealthState.DEGRADED;
        return new BackendHealth(next, at, failures, averageLatencySeconds, detail);
    }

    public BackendHealth withAverageLatency(double seconds) {
        return new BackendHealth(status, lastChecked, consecutiveFailures, seconds, lastProbeDetail);
    }

    /**
     * Whether routing may send traffic here. UNKNOWN counts only when routing is optimistic.
     */
    public boolean isRoutable(boolean optimisticUnknown) {
        return switch (status) {
            case ONLINE, DEGRADED -> true;
            case UNKNOWN -> optimisticUnknown;
            case OFFLINE -> false;
        };
    }
}
