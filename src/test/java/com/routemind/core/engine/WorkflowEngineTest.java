package com.routemind.core.engine;

import com.routemind.core.Fixtures;
import com.routemind.core.events.EventBus;
import com.routemind.core.events.RoutemindEvent;
import com.routemind.core.execution.BackendInvoker;
import com.routemind.core.execution.ExecutionSettings;
import com.routemind.core.execution.TaskGraphExecutor;
import com.routemind.core.execution.TaskOutcome;
import com.routemind.core.model.TaskState;
import com.routemind.core.model.WorkflowStatus;
import com.routemind.core.registry.BackendRegistry;
import com.routemind.core.scheduler.TaskScheduler;
import com.routemind.core.workflow.UnknownTemplateException;
import com.routemind.core.workflow.WorkflowGraphBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowEngineTest {

    private final EventBus eventBus = new EventBus();
    private TaskGraphExecutor executor;
    private WorkflowEngine engine;

    private WorkflowEngine engine(BackendInvoker invoker, int maxHistory) {
        return engine(invoker, maxHistory, 4);
    }

    private WorkflowEngine engine(BackendInvoker invoker, int maxHistory, int maxConcurrentWorkflows) {
        var registry = new BackendRegistry(Fixtures.seedBackends());
        executor = new TaskGraphExecutor(Fixtures.router(registry), Fixtures.classifier(), invoker,
                new TaskScheduler(),
                new ExecutionSettings(4, 3, 3.0, Duration.ofSeconds(5), Duration.ofSeconds(10)),
                null, eventBus);
        engine = new WorkflowEngine(new WorkflowGraphBuilder(Fixtures.catalog()), executor, eventBus, null,
                maxHistory, maxConcurrentWorkflows);
        return engine;
    }

    @AfterEach
    void tearDown() {
        if (engine != null) engine.shutdown();
        if (executor != null) executor.shutdown();
    }

    private static WorkflowRun awaitFinished(WorkflowEngine engine, String id) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            var run = engine.status(id).orElseThrow();
            if (run.isFinished()) return run;
            Thread.sleep(20);
        }
        fail("workflow " + id + " did not finish");
        return null;
    }

    @Nested
    @DisplayName("running")
    class Running {

        @Test
        @DisplayName("run executes synchronously and records the result")
        void runSynchronously() {
            var engine = engine(request -> "ok", 10);
            var outcomes = new CopyOnWriteArrayList<TaskOutcome>();
            var result = engine.run("Build a rate limiter", "code_development", Map.of(),
                    (wf, outcome) -> outcomes.add(outcome));

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(4, outcomes.size());
            var run = engine.status(result.workflowId()).orElseThrow();
            assertTrue(run.isFinished());
            assertEquals("code_development", run.templateKey());
            assertTrue(run.taskStates().values().stream().allMatch(s -> s == TaskState.DONE));
        }

        @Test
        @DisplayName("submit runs in the background")
        void submitInBackground() throws Exception {
            var engine = engine(request -> "ok", 10);
            String id = engine.submit("Document the API", null, Map.of());

            assertTrue(id.matches("WF-\\d{4}-\\d{4}"), id);
            var run = awaitFinished(engine, id);
            assertEquals(WorkflowStatus.COMPLETED, run.status());
            assertEquals("technical_docs", run.templateKey());
            assertEquals(4, run.result().outputs().size());
        }

        @Test
        @DisplayName("lifecycle events are published")
        void events() {
            var engine = engine(request -> "ok", 10);
            var events = new CopyOnWriteArrayList<RoutemindEvent>();
            eventBus.subscribeAll(events::add);
            var result = engine.run("Build a rate limiter", "code_development", Map.of(), null);

            var types = events.stream().filter(e -> result.workflowId().equals(e.workflowId()))
                    .map(RoutemindEvent::eventType).toList();
            assertEquals("workflow.created", types.get(0));
            assertEquals("workflow.finished", types.get(types.size() - 1));
        }

        @Test
        @DisplayName("ids are unique")
        void uniqueIds() {
            var engine = engine(request -> "ok", 10);
            assertNotEquals(engine.generateWorkflowId(), engine.generateWorkflowId());
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("blank prompts are rejected")
        void blankPrompt() {
            var engine = engine(request -> "ok", 10);
            assertThrows(IllegalArgumentException.class, () -> engine.plan(" ", null, Map.of()));
            assertThrows(IllegalArgumentException.class, () -> engine.submit(null, null, Map.of()));
        }

        @Test
        @DisplayName("unknown templates are rejected and nothing is registered")
        void unknownTemplate() {
            var engine = engine(request -> "ok", 10);
            assertThrows(UnknownTemplateException.class, () -> engine.submit("p", "nope", Map.of()));
            assertTrue(engine.list().isEmpty());
        }

        @Test
        @DisplayName("plan builds without running")
        void planOnly() {
            var engine = engine(request -> {
                throw new IllegalStateException("must not run");
            }, 10);
            var plan = engine.plan("Compare various databases", null, Map.of());
            assertEquals("multi_domain", plan.templateKey());
            assertEquals(5, plan.tasks().size());
            assertTrue(engine.list().isEmpty());
        }
    }

    @Nested
    @DisplayName("cancellation and history")
    class CancellationAndHistory {

        @Test
        @DisplayName("cancelling a running workflow stops remaining tasks")
        void cancelRunning() throws Exception {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var engine = engine(request -> {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "ok";
            }, 10);
            String id = engine.submit("Build a rate limiter", "code_development", Map.of());
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(engine.cancel(id));
            assertFalse(engine.cancel(id));
            release.countDown();

            var run = awaitFinished(engine, id);
            assertEquals(WorkflowStatus.CANCELLED, run.status());
            assertFalse(engine.cancel(id));
        }

        @Test
        @DisplayName("cancelling unknown or finished workflows returns false")
        void cancelUnknownOrFinished() {
            var engine = engine(request -> "ok", 10);
            assertFalse(engine.cancel("WF-1999-0001"));
            var result = engine.run("Build a rate limiter", "code_development", Map.of(), null);
            assertFalse(engine.cancel(result.workflowId()));
        }

        @Test
        @DisplayName("finished runs beyond the history limit are evicted oldest first")
        void historyEviction() {
            var engine = engine(request -> "ok", 2);
            var first = engine.run("a", "code_development", Map.of(), null);
            engine.run("b", "code_development", Map.of(), null);
            engine.run("c", "code_development", Map.of(), null);

            assertEquals(2, engine.list().size());
            assertTrue(engine.status(first.workflowId()).isEmpty());
        }
    }

    private static BackendInvoker blockingUntil(CountDownLatch started, CountDownLatch release) {
        return request -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "ok";
        };
    }

    @Nested
    @DisplayName("task state tracking")
    class TaskStateTracking {

        @Test
        @DisplayName("a started task shows as RUNNING before it finishes")
        void runningVisible() throws Exception {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var engine = engine(blockingUntil(started, release), 10);
            String id = engine.submit("Build a rate limiter", "code_development", Map.of());
            assertTrue(started.await(5, TimeUnit.SECONDS));

            var states = engine.status(id).orElseThrow().taskStates().values();
            assertTrue(states.contains(TaskState.RUNNING), states.toString());
            assertTrue(states.contains(TaskState.PENDING), states.toString());
            assertFalse(states.contains(TaskState.DONE), states.toString());

            release.countDown();
            var run = awaitFinished(engine, id);
            assertEquals(WorkflowStatus.COMPLETED, run.status());
            assertTrue(run.taskStates().values().stream().allMatch(s -> s == TaskState.DONE));
        }

        @Test
        @DisplayName("submissions beyond the concurrency limit wait with every task PENDING")
        void boundedConcurrency() throws Exception {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var engine = engine(blockingUntil(started, release), 10, 1);
            String first = engine.submit("Build a rate limiter", "code_development", Map.of());
            assertTrue(started.await(5, TimeUnit.SECONDS));
            String second = engine.submit("Build a parser", "code_development", Map.of());

            var queued = engine.status(second).orElseThrow();
            assertEquals(WorkflowStatus.RUNNING, queued.status());
            assertTrue(queued.taskStates().values().stream().allMatch(s -> s == TaskState.PENDING));

            release.countDown();
            assertEquals(WorkflowStatus.COMPLETED, awaitFinished(engine, first).status());
            assertEquals(WorkflowStatus.COMPLETED, awaitFinished(engine, second).status());
        }
    }
}
