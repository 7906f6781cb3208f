package com.routemind.core.routing;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded rolling windows of execution outcomes per backend.
 * Each window is guarded by its own monitor, so reports for different backends never contend.
 */
public class PerformanceTracker {

    private final int windowSize;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public PerformanceTracker(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be >= 1");
        }
        this.windowSize = windowSize;
    }

    public void recordRouted(String backend) {
        window(backend).routed();
    }

    /**
     * Appends one outcome and returns the new rolling average latency in seconds.
     */
    public double record(String backend, double latencySeconds, boolean success) {
        if (latencySeconds < 0 || Double.isNaN(latencySeconds)) {
            throw new IllegalArgumentException("Latency must be >= 0: " + latencySeconds);
        }
        return window(backend).add(latencySeconds, success);
    }

    public Stats stats(String backend) {
        Window w = windows.get(backend);
        return w == null ? new Stats(0, 0, 1.0, OptionalDouble.empty()) : w.stats();
    }

    /**
     * Rolling averages of every backend with at least one reported outcome.
     */
    public Map<String, Double> averageLatencies() {
        var result = new TreeMap<String, Double>();
        windows.forEach((name, w) -> w.stats().averageLatencySeconds()
                .ifPresent(avg -> result.put(name, avg)));
        return result;
    }

    private Window window(String backend) {
        return windows.computeIfAbsent(backend, k -> new Window(windowSize));
    }

    /**
     * @param averageLatencySeconds empty until an outcome has been reported
     */
    public record Stats(long routed, long reported, double successRate, OptionalDouble averageLatencySeconds) {}

    private static final class Window {
        private final int capacity;
        private final ArrayDeque<Sample> samples;
        private long routed;
        private long reported;
        private double latencySum;
        private int successes;

        private record Sample(double latency, boolean success) {}

        Window(int capacity) {
            this.capacity = capacity;
            this.samples = new ArrayDeque<>(capacity);
        }

        synchronized void routed() {
            routed++;
        }

        synchronized double add(double latency, boolean success) {
            if (samples.size() == capacity) {
                Sample evicted = samples.removeFirst();
                latencySum -= evicted.latency();
                if (evicted.success()) successes--;
            }
            samples.addLast(new Sample(latency, success));
            latencySum += latency;
            if (success) successes++;
            reported++;
            return latencySum / samples.size();
        }

        synchronized Stats stats() {
            if (samples.isEmpty()) {
                return new Stats(routed, reported, 1.0, OptionalDouble.empty());
            }
            return new Stats(routed, reported, (double) successes / samples.size(),
                    OptionalDouble.of(latencySum / samples.size()));
        }
    }
}
