package com.routemind.core.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceTrackerTest {

    @Test
    @DisplayName("average covers only the most recent window")
    void windowEviction() {
        var tracker = new PerformanceTracker(3);
        tracker.record("general", 10.0, true);
        tracker.record("general", 1.0, true);
        tracker.record("general", 2.0, true);
        assertEquals(3.0, tracker.record("general", 6.0, false), 1e-9);

        var stats = tracker.stats("general");
        assertEquals(4, stats.reported());
        assertEquals(2.0 / 3.0, stats.successRate(), 1e-9);
        assertEquals(3.0, stats.averageLatencySeconds().getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("backends without reports have neutral stats")
    void emptyStats() {
        var stats = new PerformanceTracker(10).stats("unknown");
        assertEquals(0, stats.routed());
        assertEquals(1.0, stats.successRate());
        assertTrue(stats.averageLatencySeconds().isEmpty());
    }

    @Test
    @DisplayName("only backends with reports appear in the latency map")
    void averageLatencies() {
        var tracker = new PerformanceTracker(10);
        tracker.recordRouted("coding");
        tracker.record("general", 1.5, true);
        assertEquals(java.util.Map.of("general", 1.5), tracker.averageLatencies());
    }

    @Test
    @DisplayName("negative latency and a zero window are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new PerformanceTracker(0));
        assertThrows(IllegalArgumentException.class, () -> new PerformanceTracker(5).record("a", -1.0, true));
    }

    @Test
    @DisplayName("concurrent reports are all counted")
    void concurrentReports() throws Exception {
        var tracker = new PerformanceTracker(100_000);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        tracker.record("general", 2.0, true);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(8000, tracker.stats("general").reported());
        assertEquals(2.0, tracker.stats("general").averageLatencySeconds().getAsDouble(), 1e-9);
    }
}
