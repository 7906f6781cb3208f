package com.routemind.core.routing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.routemind.core.registry.BackendRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persists learned average latencies between restarts as a small JSON document
 * ({@code {"reasoning": 2.31, ...}}), so routing after a restart starts from observed
 * traffic instead of configured seed values.
 */
public class LearnedMetricsStore {

    private static final Logger log = LoggerFactory.getLogger(LearnedMetricsStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public LearnedMetricsStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path file() {
        return file;
    }

    /**
     * Seeds the registry with stored latencies. Entries for backends that are no longer
     * registered are skipped. A missing file is not an error.
     *
     * @return number of backends seeded
     */
    public int restore(BackendRegistry registry) {
        if (!Files.exists(file)) {
            log.info("No learned metrics at {}, using configured latencies", file);
            return 0;
        }
        Map<String, Double> latencies;
        try {
            latencies = objectMapper.readValue(file.toFile(), new TypeReference<Map<String, Double>>() {});
        } catch (IOException e) {
            log.warn("Ignoring unreadable learned metrics file {}: {}", file, e.getMessage());
            return 0;
        }
        int seeded = 0;
        for (var entry : latencies.entrySet()) {
            if (registry.get(entry.getKey()).isEmpty() || entry.getValue() == null || entry.getValue() < 0) {
                log.debug("Skipping learned latency for {}", entry.getKey());
                continue;
            }
            registry.seedLatency(entry.getKey(), entry.getValue());
            seeded++;
        }
        log.info("Restored learned latency for {} backend(s) from {}", seeded, file);
        return seeded;
    }

    /**
     * Writes {@code averageLatencies} over the stored values; backends without new
     * observations keep what was stored before.
     */
    public void save(Map<String, Double> averageLatencies) {
        var merged = new TreeMap<String, Double>();
        if (Files.exists(file)) {
            try {
                merged.putAll(objectMapper.readValue(file.toFile(), new TypeReference<Map<String, Double>>() {}));
            } catch (IOException e) {
                log.warn("Overwriting unreadable learned metrics file {}: {}", file, e.getMessage());
            }
        }
        merged.putAll(averageLatencies);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), merged);
            log.info("Saved learned latency for {} backend(s) to {}", averageLatencies.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write learned metrics to " + file, e);
        }
    }
}
