package com.routemind.core.model;

import com.routemind.core.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("BackendDescriptor")
    class Descriptor {

        @Test
        @DisplayName("normalizes trailing slash and fills defaults")
        void normalizes() {
            var d = new BackendDescriptor("general", "http://localhost:8001/", WireFormat.OPENAI_COMPATIBLE,
                    null, 0.0002, 0.85, 1.2, ComplexityLevel.MODERATE, null, null, null, null, null, null);
            assertEquals("http://localhost:8001", d.endpoint());
            assertEquals(List.of(), d.specialties());
            assertEquals(List.of(), d.fallbackChain());
            assertEquals(BackendDescriptor.DEFAULT_HEALTH_ENDPOINTS, d.healthEndpoints());
            assertEquals("llm", d.backendType());
        }

        @Test
        @DisplayName("rejects performance score outside [0,1]")
        void rejectsPerformance() {
            assertThrows(IllegalArgumentException.class, () ->
                    Fixtures.backend("x", ComplexityLevel.SIMPLE, List.of(), 1.5, 0.0, 1.0));
        }

        @Test
        @DisplayName("rejects negative cost and latency")
        void rejectsNegatives() {
            assertThrows(IllegalArgumentException.class, () ->
                    Fixtures.backend("x", ComplexityLevel.SIMPLE, List.of(), 0.5, -1.0, 1.0));
            assertThrows(IllegalArgumentException.class, () ->
                    Fixtures.backend("x", ComplexityLevel.SIMPLE, List.of(), 0.5, 0.0, -1.0));
        }

        @Test
        @DisplayName("custom wire format requires an invocation path")
        void customNeedsPath() {
            assertThrows(IllegalArgumentException.class, () ->
                    Fixtures.atEndpoint("creative", "http://localhost:5001", WireFormat.CUSTOM, null));
            assertDoesNotThrow(() ->
                    Fixtures.atEndpoint("creative", "http://localhost:5001", WireFormat.CUSTOM, "/api/v1/generate"));
        }

        @Test
        @DisplayName("specialty lookup ignores case")
        void specialtyIgnoresCase() {
            var d = Fixtures.backend("coding", ComplexityLevel.COMPLEX, List.of("Code", "debug"), 0.9, 0.0, 1.0);
            assertTrue(d.hasSpecialty("code"));
            assertTrue(d.hasSpecialty("DEBUG"));
            assertFalse(d.hasSpecialty("story"));
            assertFalse(d.hasSpecialty(null));
        }
    }

    @Nested
    @DisplayName("BackendHealth")
    class Health {

        private final Instant now = Instant.parse("2026-01-01T00:00:00Z");

        @Test
        @DisplayName("starts UNKNOWN with the seed latency")
        void startsUnknown() {
            var h = BackendHealth.unknown(2.5);
            assertEquals(HealthState.UNKNOWN, h.status());
            assertEquals(2.5, h.averageLatencySeconds());
            assertNull(h.lastChecked());
        }

        @Test
        @DisplayName("failures degrade until the threshold, then go offline")
        void failureSequence() {
            var h = BackendHealth.unknown(1.0).afterProbeFailure(now, 3, "refused");
            assertEquals(HealthState.DEGRADED, h.status());
            h = h.afterProbeFailure(now, 3, "refused");
            assertEquals(HealthState.DEGRADED, h.status());
            h = h.afterProbeFailure(now, 3, "refused");
            assertEquals(HealthState.OFFLINE, h.status());
            assertEquals(3, h.consecutiveFailures());
        }

        @Test
        @DisplayName("one success resets failures and goes online")
        void successResets() {
            var h = BackendHealth.unknown(1.0)
                    .afterProbeFailure(now, 1, "refused")
                    .afterProbeSuccess(now, "/health");
            assertEquals(HealthState.ONLINE, h.status());
            assertEquals(0, h.consecutiveFailures());
            assertEquals("/health", h.lastProbeDetail());
        }

        @Test
        @DisplayName("UNKNOWN is routable only when optimistic")
        void unknownRoutability() {
            var h = BackendHealth.unknown(1.0);
            assertTrue(h.isRoutable(true));
            assertFalse(h.isRoutable(false));
        }

        @Test
        @DisplayName("DEGRADED stays routable, OFFLINE never is")
        void degradedAndOffline() {
            var degraded = BackendHealth.unknown(1.0).afterProbeFailure(now, 3, "x");
            var offline = BackendHealth.unknown(1.0).afterProbeFailure(now, 1, "x");
            assertTrue(degraded.isRoutable(false));
            assertFalse(offline.isRoutable(true));
        }
    }

    @Nested
    @DisplayName("tags")
    class Tags {

        @Test
        @DisplayName("complexity levels are ordered")
        void complexityOrder() {
            assertTrue(ComplexityLevel.EXPERT.meets(ComplexityLevel.COMPLEX));
            assertTrue(ComplexityLevel.MODERATE.meets(ComplexityLevel.MODERATE));
            assertFalse(ComplexityLevel.MODERATE.meets(ComplexityLevel.EXPERT));
        }

        @Test
        @DisplayName("tags parse case-insensitively and reject unknown values")
        void parsing() {
            assertEquals(ComplexityLevel.EXPERT, ComplexityLevel.fromTag(" Expert "));
            assertEquals(TaskType.CODING, TaskType.fromTag("coding"));
            assertEquals(WireFormat.OPENAI_COMPATIBLE, WireFormat.fromTag(WireFormat.OPENAI_COMPATIBLE.tag()));
            assertThrows(IllegalArgumentException.class, () -> ComplexityLevel.fromTag("trivial"));
            assertThrows(IllegalArgumentException.class, () -> TaskType.fromTag(""));
        }

        @Test
        @DisplayName("advanced is an alias of research")
        void advancedAlias() {
            assertEquals(TaskType.RESEARCH, TaskType.fromTag("advanced"));
        }
    }

    @Nested
    @DisplayName("Task")
    class Tasks {

        @Test
        @DisplayName("defaults to PENDING and copies context")
        void defaults() {
            var context = new java.util.HashMap<String, Object>(Map.of("k", "v"));
            var task = new Task("t-research-0", TaskType.RESEARCH, "p", context, null, null, null);
            context.put("k", "changed");
            assertEquals(TaskState.PENDING, task.state());
            assertEquals("v", task.context().get("k"));
            assertEquals(List.of(), task.dependencies());
            assertEquals(TaskState.DONE, task.withState(TaskState.DONE).state());
        }

        @Test
        @DisplayName("terminal states")
        void terminal() {
            assertTrue(TaskState.DONE.isTerminal());
            assertTrue(TaskState.FAILED.isTerminal());
            assertFalse(TaskState.PENDING.isTerminal());
            assertFalse(TaskState.RUNNING.isTerminal());
        }
    }
}
