package com.routemind.core.registry;

import com.routemind.core.config.RoutemindProperties;
import com.routemind.core.events.EventBus;
import com.routemind.core.events.RoutemindEvent;
import com.routemind.core.metrics.RoutemindMetrics;
import com.routemind.core.model.BackendSnapshot;
import com.routemind.core.model.HealthState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically probes every registered backend and records the result in the registry.
 * <p>
 * One scheduler thread drives ticks; each tick fans out on a fixed probe pool. Probe
 * failures only move health state and are never thrown to callers. Routing reads the
 * cached snapshots and never waits on a probe.
 */
@Service
public class BackendHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthMonitor.class);

    private final BackendRegistry registry;
    private final HealthProbe probe;
    private final boolean enabled;
    private final int intervalSeconds;
    private final Duration probeTimeout;
    private final int failureThreshold;
    private final RoutemindMetrics metrics;
    private final EventBus eventBus;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "health-monitor");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService probePool;

    @Autowired
    public BackendHealthMonitor(BackendRegistry registry, HealthProbe probe, RoutemindProperties properties,
                                RoutemindMetrics metrics, EventBus eventBus) {
        this(registry, probe, properties.isHealthEnabled(), properties.getHealthIntervalSeconds(),
                Duration.ofSeconds(properties.getProbeTimeoutSeconds()), properties.getFailureThreshold(),
                properties.getMaxConcurrentProbes(), metrics, eventBus);
    }

    BackendHealthMonitor(BackendRegistry registry, HealthProbe probe, int failureThreshold) {
        this(registry, probe, false, 30, Duration.ofSeconds(5), failureThreshold, 4, null, new EventBus());
    }

    BackendHealthMonitor(BackendRegistry registry, HealthProbe probe, boolean enabled, int intervalSeconds,
                         Duration probeTimeout, int failureThreshold, int maxConcurrentProbes,
                         RoutemindMetrics metrics, EventBus eventBus) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be >= 1");
        }
        this.registry = registry;
        this.probe = probe;
        this.enabled = enabled;
        this.intervalSeconds = intervalSeconds;
        this.probeTimeout = probeTimeout;
        this.failureThreshold = failureThreshold;
        this.metrics = metrics;
        this.eventBus = eventBus;
        var counter = new AtomicInteger();
        this.probePool = Executors.newFixedThreadPool(Math.max(1, maxConcurrentProbes), r -> {
            Thread t = new Thread(r, "health-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("Backend health monitor disabled");
            return;
        }
        scheduler.scheduleAtFixedRate(this::scheduledTick, 0, intervalSeconds, TimeUnit.SECONDS);
        log.info("Backend health monitor started (interval={}s, timeout={}ms, threshold={})",
                intervalSeconds, probeTimeout.toMillis(), failureThreshold);
    }

    @PreDestroy
    void stop() {
        scheduler.shutdown();
        probePool.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!probePool.awaitTermination(5, TimeUnit.SECONDS)) {
                probePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            probePool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Backend health monitor stopped");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getIntervalSeconds() {
        return intervalSeconds;
    }

    /**
     * Runs one probe round synchronously and returns the resulting snapshots.
     */
    public List<BackendSnapshot> probeNow() {
        tick();
        return registry.listAll();
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the periodic schedule
            log.warn("Health probe round failed: {}", e.getMessage(), e);
        }
    }

    synchronized void tick() {
        var backends = registry.listAll();
        var futures = new ArrayList<Future<ProbeResult>>(backends.size());
        for (var backend : backends) {
            futures.add(probePool.submit(() -> probe.probe(backend.descriptor(), probeTimeout)));
        }
        // every endpoint may use its full timeout, plus slack for queueing behind other probes
        long waitMs = probeTimeout.toMillis() * 4 + 1000;
        for (int i = 0; i < backends.size(); i++) {
            String name = backends.get(i).name();
            ProbeResult result = await(futures.get(i), name, waitMs);
            record(name, result);
        }
    }

    private ProbeResult await(Future<ProbeResult> future, String name, long waitMs) {
        try {
            ProbeResult result = future.get(waitMs, TimeUnit.MILLISECONDS);
            return result != null ? result : ProbeResult.down("probe returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProbeResult.down("probe did not finish within " + waitMs + "ms");
        } catch (ExecutionException e) {
            log.warn("Probe of {} threw: {}", name, e.getCause().getMessage());
            return ProbeResult.down("probe error: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.down("probe interrupted");
        }
    }

    private void record(String name, ProbeResult result) {
        var transition = registry.applyProbe(name, result, failureThreshold, Instant.now());
        if (metrics != null) {
            metrics.recordProbeResult(name, result.healthy());
        }
        if (!transition.statusChanged()) {
            log.debug("Backend {} still {} ({})", name, transition.after().status(), result.detail());
            return;
        }
        HealthState from = transition.before().status();
        HealthState to = transition.after().status();
        if (to == HealthState.ONLINE) {
            log.info("Backend {} is ONLINE (was {}, via {})", name, from, result.detail());
        } else {
            log.warn("Backend {} is {} after {} failed probe(s): {}", name, to,
                    transition.after().consecutiveFailures(), result.detail());
        }
        if (metrics != null) {
            metrics.recordBackendTransition(name, to.name());
        }
        eventBus.publish(RoutemindEvent.of("backend.status_changed", null, null,
                Map.of("backend", name, "from", from.name(), "to", to.name(), "detail", result.detail())));
    }
}
