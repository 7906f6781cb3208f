package com.routemind.core.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routemind.core.config.RoutemindProperties;
import com.routemind.core.registry.BackendRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Restores learned latencies at startup and saves them at shutdown when
 * {@code routemind.routing.learned-metrics-file} is set.
 */
@Component
public class LearnedLatencyLoop {

    private static final Logger log = LoggerFactory.getLogger(LearnedLatencyLoop.class);

    private final BackendRegistry registry;
    private final PerformanceTracker tracker;
    private final LearnedMetricsStore store;

    public LearnedLatencyLoop(BackendRegistry registry, PerformanceTracker tracker,
                              RoutemindProperties properties, ObjectMapper objectMapper) {
        this.registry = registry;
        this.tracker = tracker;
        String location = properties.getLearnedMetricsFile();
        this.store = location == null || location.isBlank()
                ? null : new LearnedMetricsStore(Path.of(location), objectMapper);
    }

    @PostConstruct
    void restore() {
        if (store != null) {
            store.restore(registry);
        }
    }

    @PreDestroy
    void save() {
        if (store == null) {
            return;
        }
        var latencies = tracker.averageLatencies();
        if (latencies.isEmpty()) {
            log.debug("No observed latencies to save");
            return;
        }
        try {
            store.save(latencies);
        } catch (UncheckedIOException e) {
            log.warn("Learned latencies not saved: {}", e.getMessage(), e);
        }
    }
}
