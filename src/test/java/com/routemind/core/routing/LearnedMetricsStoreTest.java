package com.routemind.core.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routemind.core.Fixtures;
import com.routemind.core.registry.BackendRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LearnedMetricsStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("saved latencies seed a fresh registry")
    void saveThenRestore() {
        var store = new LearnedMetricsStore(tempDir.resolve("learned.json"), objectMapper);
        store.save(Map.of("general", 0.7, "coding", 3.1));

        var registry = new BackendRegistry(Fixtures.seedBackends());
        assertEquals(2, store.restore(registry));
        assertEquals(0.7, registry.get("general").orElseThrow().averageLatencySeconds(), 1e-9);
        assertEquals(3.1, registry.get("coding").orElseThrow().averageLatencySeconds(), 1e-9);
        assertEquals(2.5, registry.get("reasoning").orElseThrow().averageLatencySeconds(), 1e-9);
    }

    @Test
    @DisplayName("saving keeps entries for backends without new observations")
    void saveMerges() throws Exception {
        Path file = tempDir.resolve("learned.json");
        var store = new LearnedMetricsStore(file, objectMapper);
        store.save(Map.of("general", 0.7, "coding", 3.1));
        store.save(Map.of("general", 0.9));

        @SuppressWarnings("unchecked")
        Map<String, Double> stored = objectMapper.readValue(file.toFile(), Map.class);
        assertEquals(0.9, stored.get("general"), 1e-9);
        assertEquals(3.1, stored.get("coding"), 1e-9);
    }

    @Test
    @DisplayName("a missing file restores nothing")
    void missingFile() {
        var store = new LearnedMetricsStore(tempDir.resolve("absent.json"), objectMapper);
        assertEquals(0, store.restore(new BackendRegistry(Fixtures.seedBackends())));
    }

    @Test
    @DisplayName("an unreadable file is ignored")
    void unreadableFile() throws Exception {
        Path file = tempDir.resolve("learned.json");
        Files.writeString(file, "{not json");
        var store = new LearnedMetricsStore(file, objectMapper);
        assertEquals(0, store.restore(new BackendRegistry(Fixtures.seedBackends())));
    }

    @Test
    @DisplayName("entries for unregistered backends and negative values are skipped")
    void skipsUnknownAndNegative() throws Exception {
        Path file = tempDir.resolve("learned.json");
        Files.writeString(file, "{\"ghost\": 1.0, \"general\": -2.0, \"coding\": 1.1}");
        var registry = new BackendRegistry(Fixtures.seedBackends());
        assertEquals(1, new LearnedMetricsStore(file, objectMapper).restore(registry));
        assertEquals(1.2, registry.get("general").orElseThrow().averageLatencySeconds(), 1e-9);
    }

    @Test
    @DisplayName("parent directories are created on save")
    void createsDirectories() {
        Path file = tempDir.resolve("nested/dir/learned.json");
        new LearnedMetricsStore(file, objectMapper).save(Map.of("general", 1.0));
        assertTrue(Files.exists(file));
    }
}
