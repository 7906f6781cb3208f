package com.routemind.core.registry;

import com.routemind.core.model.BackendDescriptor;
import com.routemind.core.model.BackendHealth;
import com.routemind.core.model.BackendSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Catalog of backends in registration order.
 * <p>
 * Descriptors never change after registration. Each backend's health and cached latency
 * live in an immutable {@link BackendHealth} swapped atomically, so every read returns
 * a consistent snapshot. Health is written only by {@link BackendHealthMonitor} (through
 * the package-private {@link #applyProbe}); latency only through
 * {@link #updateAverageLatency} and {@link #seedLatency}.
 */
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private record Entry(BackendDescriptor descriptor, AtomicReference<BackendHealth> health) {
        BackendSnapshot snapshot() {
            return new BackendSnapshot(descriptor, health.get());
        }
    }

    /** Outcome of applying one probe: the snapshot before and after. */
    record Transition(BackendHealth before, BackendHealth after) {
        boolean statusChanged() {
            return before.status() != after.status();
        }
    }

    private final CopyOnWriteArrayList<Entry> ordered = new CopyOnWriteArrayList<>();
    private final Map<String, Entry> byName = new ConcurrentHashMap<>();

    public BackendRegistry() {
    }

    public BackendRegistry(List<BackendDescriptor> descriptors) {
        descriptors.forEach(this::register);
    }

    /**
     * Registers a backend with UNKNOWN health.
     *
     * @throws InvalidBackendDefinitionException if the name is already registered
     */
    public synchronized void register(BackendDescriptor descriptor) {
        if (byName.containsKey(descriptor.name())) {
            throw new InvalidBackendDefinitionException("Duplicate backend name: " + descriptor.name());
        }
        var entry = new Entry(descriptor,
                new AtomicReference<>(BackendHealth.unknown(descriptor.averageLatencySeconds())));
        byName.put(descriptor.name(), entry);
        ordered.add(entry);
        log.info("Registered backend {} ({}, ceiling {}) at {}", descriptor.name(),
                descriptor.wireFormat().tag(), descriptor.maxComplexity().tag(), descriptor.endpoint());
    }

    public Optional<BackendSnapshot> get(String name) {
        Entry entry = name == null ? null : byName.get(name);
        return Optional.ofNullable(entry).map(Entry::snapshot);
    }

    public List<BackendSnapshot> listAll() {
        var result = new ArrayList<BackendSnapshot>(ordered.size());
        for (Entry entry : ordered) {
            result.add(entry.snapshot());
        }
        return result;
    }

    /**
     * Backends declaring {@code specialty} (case-insensitive), in registration order.
     */
    public List<BackendSnapshot> findBySpecialty(String specialty) {
        return ordered.stream()
                .filter(e -> e.descriptor().hasSpecialty(specialty))
                .map(Entry::snapshot)
                .toList();
    }

    public int size() {
        return ordered.size();
    }

    /**
     * Checks that every fallback chain names registered backends, never names its own
     * backend, and that following chains can never loop.
     *
     * @throws InvalidBackendDefinitionException on the first violation found
     */
    public void validateFallbackChains() {
        for (Entry entry : ordered) {
            var descriptor = entry.descriptor();
            for (String fallback : descriptor.fallbackChain()) {
                if (fallback.equals(descriptor.name())) {
                    throw new InvalidBackendDefinitionException(
                            "Backend '" + descriptor.name() + "' lists itself as a fallback");
                }
                if (!byName.containsKey(fallback)) {
                    throw new InvalidBackendDefinitionException(
                            "Backend '" + descriptor.name() + "' falls back to unknown backend '" + fallback + "'");
                }
            }
        }
        Set<String> done = new HashSet<>();
        for (Entry entry : ordered) {
            detectCycle(entry.descriptor().name(), new ArrayList<>(), done);
        }
    }

    private void detectCycle(String name, List<String> path, Set<String> done) {
        if (done.contains(name)) return;
        if (path.contains(name)) {
            var cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            throw new InvalidBackendDefinitionException("Fallback cycle: " + String.join(" -> ", cycle));
        }
        path.add(name);
        for (String next : byName.get(name).descriptor().fallbackChain()) {
            detectCycle(next, path, done);
        }
        path.remove(path.size() - 1);
        done.add(name);
    }

    /**
     * Replaces the cached rolling latency of a backend. Unknown names are ignored.
     */
    public void updateAverageLatency(String name, double seconds) {
        Entry entry = byName.get(name);
        if (entry != null) {
            entry.health().updateAndGet(h -> h.withAverageLatency(seconds));
        }
    }

    /**
     * Restores a previously learned latency as the starting point for a backend.
     */
    public void seedLatency(String name, double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Latency must be >= 0: " + seconds);
        }
        updateAverageLatency(name, seconds);
    }

    Transition applyProbe(String name, ProbeResult result, int failureThreshold, Instant at) {
        Entry entry = byName.get(name);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown backend: " + name);
        }
        var before = new AtomicReference<BackendHealth>();
        BackendHealth after = entry.health().updateAndGet(h -> {
            before.set(h);
            return result.healthy()
                    ? h.afterProbeSuccess(at, result.detail())
                    : h.afterProbeFailure(at, failureThreshold, result.detail());
        });
        return new Transition(before.get(), after);
    }
}
