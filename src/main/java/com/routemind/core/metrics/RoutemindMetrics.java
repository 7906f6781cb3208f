package com.routemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for routing, health probing and task execution.
 */
@Service
public class RoutemindMetrics {

    private final MeterRegistry registry;

    public RoutemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRouteDecision(String backend, String taskType, boolean viaFallback) {
        Counter.builder("routemind.route.decisions")
                .tag("backend", backend)
                .tag("taskType", taskType)
                .tag("fallback", String.valueOf(viaFallback))
                .register(registry)
                .increment();
    }

    public void recordRouteUnavailable(String taskType) {
        Counter.builder("routemind.route.unavailable")
                .description("Routing requests with no routable backend")
                .tag("taskType", taskType)
                .register(registry)
                .increment();
    }

    public void recordProbeResult(String backend, boolean healthy) {
        Counter.builder("routemind.probe.results")
                .tag("backend", backend)
                .tag("result", healthy ? "up" : "down")
                .register(registry)
                .increment();
    }

    /**
     * Records a health state change of a backend.
     *
     * @param to the new state name (ONLINE, DEGRADED, OFFLINE)
     */
    public void recordBackendTransition(String backend, String to) {
        Counter.builder("routemind.backend.transitions")
                .tag("backend", backend)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String taskType, String backend, long ms, boolean success) {
        Timer.builder("routemind.task.duration")
                .tag("taskType", taskType)
                .tag("backend", backend)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskAttempts(String taskType, int attempts) {
        DistributionSummary.builder("routemind.task.attempts")
                .description("Backend attempts needed per task")
                .tag("taskType", taskType)
                .register(registry)
                .record(attempts);
    }

    public void recordWorkflowResult(String status) {
        Counter.builder("routemind.workflow.results")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
