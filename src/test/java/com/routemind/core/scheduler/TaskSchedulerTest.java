package com.routemind.core.scheduler;

import com.routemind.core.model.Task;
import com.routemind.core.model.TaskState;
import com.routemind.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private final TaskScheduler scheduler = new TaskScheduler();

    private static Task task(String id, List<String> deps, String group) {
        return new Task(id, TaskType.GENERAL, "p", Map.of(), deps, group, null);
    }

    private static Map<String, TaskState> states(Object... pairs) {
        var map = new HashMap<String, TaskState>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (TaskState) pairs[i + 1]);
        }
        return map;
    }

    @Nested
    @DisplayName("computeNextWave")
    class NextWave {

        @Test
        @DisplayName("roots are eligible first")
        void roots() {
            var tasks = List.of(task("a", List.of(), null), task("b", List.of("a"), null), task("c", List.of(), null));
            assertEquals(List.of("a", "c"), scheduler.computeNextWave(tasks, states(), 10));
        }

        @Test
        @DisplayName("a task becomes eligible only when all dependencies are DONE")
        void waitsForDependencies() {
            var tasks = List.of(task("a", List.of(), null), task("b", List.of(), null),
                    task("c", List.of("a", "b"), null));
            assertEquals(List.of(), scheduler.computeNextWave(tasks,
                    states("a", TaskState.DONE, "b", TaskState.RUNNING), 10));
            assertEquals(List.of("c"), scheduler.computeNextWave(tasks,
                    states("a", TaskState.DONE, "b", TaskState.DONE), 10));
        }

        @Test
        @DisplayName("a failed dependency never releases its dependent")
        void failedDependency() {
            var tasks = List.of(task("a", List.of(), null), task("b", List.of("a"), null));
            assertEquals(List.of(), scheduler.computeNextWave(tasks, states("a", TaskState.FAILED), 10));
        }

        @Test
        @DisplayName("non-pending tasks are skipped")
        void skipsStarted() {
            var tasks = List.of(task("a", List.of(), null), task("b", List.of(), null));
            assertEquals(List.of("b"), scheduler.computeNextWave(tasks, states("a", TaskState.READY), 10));
        }

        @Test
        @DisplayName("the limit caps the wave")
        void limit() {
            var tasks = List.of(task("a", List.of(), null), task("b", List.of(), null), task("c", List.of(), null));
            assertEquals(List.of("a", "b"), scheduler.computeNextWave(tasks, states(), 2));
            assertEquals(List.of(), scheduler.computeNextWave(tasks, states(), 0));
        }

        @Test
        @DisplayName("a group is held back until every member is ready")
        void groupHeldBack() {
            var tasks = List.of(
                    task("r", List.of(), null),
                    task("x", List.of("r"), "g"),
                    task("y", List.of(), "g"));
            assertEquals(List.of("r"), scheduler.computeNextWave(tasks, states(), 10));
            assertEquals(List.of("x", "y"), scheduler.computeNextWave(tasks, states("r", TaskState.DONE), 10));
        }

        @Test
        @DisplayName("a group is never split by the limit")
        void groupNotSplit() {
            var tasks = List.of(
                    task("a", List.of(), null),
                    task("x", List.of(), "g"),
                    task("y", List.of(), "g"));
            assertEquals(List.of("a"), scheduler.computeNextWave(tasks, states(), 2));
            assertEquals(List.of("x", "y"), scheduler.computeNextWave(tasks, states("a", TaskState.RUNNING), 2));
        }

        @Test
        @DisplayName("an oversized group still runs when the wave is otherwise empty")
        void oversizedGroup() {
            var tasks = List.of(task("x", List.of(), "g"), task("y", List.of(), "g"), task("z", List.of(), "g"));
            assertEquals(List.of("x", "y", "z"), scheduler.computeNextWave(tasks, states(), 2));
        }
    }

    @Test
    @DisplayName("transitive dependents in creation order")
    void transitiveDependents() {
        var tasks = List.of(
                task("a", List.of(), null),
                task("b", List.of("a"), null),
                task("c", List.of(), null),
                task("d", List.of("b", "c"), null));
        assertEquals(List.of("b", "d"), scheduler.transitiveDependents(tasks, "a"));
        assertEquals(List.of("d"), scheduler.transitiveDependents(tasks, "c"));
        assertEquals(List.of(), scheduler.transitiveDependents(tasks, "d"));
    }

    @Test
    @DisplayName("settled once every task is DONE or FAILED")
    void settled() {
        var tasks = List.of(task("a", List.of(), null), task("b", List.of(), null));
        assertFalse(scheduler.isSettled(tasks, states("a", TaskState.DONE)));
        assertTrue(scheduler.isSettled(tasks, states("a", TaskState.DONE, "b", TaskState.FAILED)));
    }
}
