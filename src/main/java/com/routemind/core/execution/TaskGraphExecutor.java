package com.routemind.core.execution;

import com.routemind.core.classifier.PromptClassifier;
import com.routemind.core.config.RoutemindProperties;
import com.routemind.core.events.EventBus;
import com.routemind.core.events.RoutemindEvent;
import com.routemind.core.logging.MdcContext;
import com.routemind.core.metrics.RoutemindMetrics;
import com.routemind.core.model.RoutingDecision;
import com.routemind.core.model.Task;
import com.routemind.core.model.TaskState;
import com.routemind.core.model.WorkflowStatus;
import com.routemind.core.routing.BackendRouter;
import com.routemind.core.routing.NoHealthyBackendException;
import com.routemind.core.scheduler.TaskScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a task graph against the backend registry.
 * <p>
 * Tasks start only once every dependency is DONE; parallel groups are released
 * together by {@link TaskScheduler}. Each task is routed by its type, then tried on the
 * selected backend and its fallbacks under a per-attempt timeout derived from the
 * backend's cached latency. A failed task fails its transitive dependents without
 * running them; independent branches carry on.
 */
@Service
public class TaskGraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphExecutor.class);

    private final BackendRouter router;
    private final PromptClassifier classifier;
    private final BackendInvoker invoker;
    private final TaskScheduler scheduler;
    private final ExecutionSettings settings;
    private final RoutemindMetrics metrics;
    private final EventBus eventBus;

    private final ExecutorService workers;
    private final ExecutorService invocations;

    @Autowired
    public TaskGraphExecutor(BackendRouter router, PromptClassifier classifier, BackendInvoker invoker,
                             TaskScheduler scheduler, RoutemindProperties properties,
                             RoutemindMetrics metrics, EventBus eventBus) {
        this(router, classifier, invoker, scheduler,
                new ExecutionSettings(properties.getMaxParallel(), properties.getMaxAttempts(),
                        properties.getTimeoutMultiplier(),
                        Duration.ofSeconds(properties.getMinTimeoutSeconds()),
                        Duration.ofSeconds(properties.getMaxTimeoutSeconds())),
                metrics, eventBus);
    }

    public TaskGraphExecutor(BackendRouter router, PromptClassifier classifier, BackendInvoker invoker,
                             TaskScheduler scheduler, ExecutionSettings settings,
                             RoutemindMetrics metrics, EventBus eventBus) {
        this.router = router;
        this.classifier = classifier;
        this.invoker = invoker;
        this.scheduler = scheduler;
        this.settings = settings;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.workers = Executors.newFixedThreadPool(settings.maxParallel(), namedThreads("task-worker"));
        // attempts block on these futures, so the pool must not be smaller than the worker pool
        this.invocations = Executors.newFixedThreadPool(settings.maxParallel(), namedThreads("backend-call"));
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        invocations.shutdownNow();
    }

    public ExecutionSettings settings() {
        return settings;
    }

    public WorkflowResult execute(String workflowId, List<Task> tasks, TaskResultListener listener) {
        return execute(workflowId, tasks, listener, new CancellationToken());
    }

    /**
     * Runs the graph to completion on the calling thread, dispatching tasks to the worker pool.
     *
     * @throws IllegalArgumentException if task ids repeat or a dependency names an unknown task
     */
    public WorkflowResult execute(String workflowId, List<Task> tasks, TaskResultListener listener,
                                  CancellationToken token) {
        validateGraph(tasks);
        long startMs = System.currentTimeMillis();
        MdcContext.setWorkflow(workflowId);
        var byId = new HashMap<String, Task>();
        tasks.forEach(t -> byId.put(t.id(), t));

        Map<String, TaskState> states = new ConcurrentHashMap<>();
        tasks.forEach(t -> states.put(t.id(), TaskState.PENDING));
        Map<String, String> outputs = new ConcurrentHashMap<>();
        var failures = new ArrayList<WorkflowResult.TaskFailure>();
        CompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(workers);
        int inFlight = 0;

        try {
            while (true) {
                if (token.isCancelled()) {
                    for (Task task : tasks) {
                        if (states.get(task.id()) == TaskState.PENDING) {
                            settle(workflowId, TaskOutcome.failed(task.id(), task.type(), null, "cancelled", 0, 0),
                                    states, outputs, failures, listener);
                        }
                    }
                } else {
                    for (String id : scheduler.computeNextWave(tasks, states,
                            settings.maxParallel() - inFlight)) {
                        Task task = byId.get(id);
                        states.put(id, TaskState.READY);
                        var context = dependencyContext(task, outputs);
                        completion.submit(() -> runTask(workflowId, task, context, states, token));
                        inFlight++;
                    }
                }

                if (inFlight == 0) {
                    // nothing running and nothing eligible: any PENDING task is unreachable
                    for (Task task : tasks) {
                        if (states.get(task.id()) == TaskState.PENDING) {
                            settle(workflowId, TaskOutcome.failed(task.id(), task.type(), null,
                                    "dependencies can never complete", 0, 0), states, outputs, failures, listener);
                        }
                    }
                    break;
                }

                TaskOutcome outcome = takeNext(completion);
                inFlight--;
                settle(workflowId, outcome, states, outputs, failures, listener);
                if (!outcome.succeeded()) {
                    for (String dependent : scheduler.transitiveDependents(tasks, outcome.taskId())) {
                        if (states.get(dependent) == TaskState.PENDING) {
                            Task t = byId.get(dependent);
                            settle(workflowId, TaskOutcome.failed(dependent, t.type(), null,
                                    "dependency " + outcome.taskId() + " failed", 0, 0),
                                    states, outputs, failures, listener);
                        }
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            log.warn("Workflow {} interrupted; remaining tasks marked cancelled", workflowId);
            for (Task task : tasks) {
                if (!states.get(task.id()).isTerminal()) {
                    settle(workflowId, TaskOutcome.failed(task.id(), task.type(), null, "cancelled", 0, 0),
                            states, outputs, failures, listener);
                }
            }
        } finally {
            MdcContext.clear();
        }

        var ordered = new LinkedHashMap<String, TaskState>();
        tasks.forEach(t -> ordered.put(t.id(), states.get(t.id())));
        var orderedOutputs = new LinkedHashMap<String, String>();
        tasks.forEach(t -> {
            if (outputs.containsKey(t.id())) orderedOutputs.put(t.id(), outputs.get(t.id()));
        });
        WorkflowStatus status = overallStatus(tasks.size(), orderedOutputs.size(), token.isCancelled());
        long elapsed = System.currentTimeMillis() - startMs;
        log.info("Workflow {} finished {}: {} done, {} failed in {}ms", workflowId, status,
                orderedOutputs.size(), failures.size(), elapsed);
        return new WorkflowResult(workflowId, status, ordered, orderedOutputs, failures, elapsed);
    }

    static WorkflowStatus overallStatus(int total, int done, boolean cancelled) {
        if (cancelled) return WorkflowStatus.CANCELLED;
        if (done == total) return WorkflowStatus.COMPLETED;
        return done == 0 ? WorkflowStatus.FAILED : WorkflowStatus.PARTIAL;
    }

    private TaskOutcome takeNext(CompletionService<TaskOutcome> completion) throws InterruptedException {
        Future<TaskOutcome> future = completion.take();
        try {
            return future.get();
        } catch (ExecutionException e) {
            // runTask converts every failure into an outcome; reaching here is a bug
            throw new IllegalStateException("Task worker failed unexpectedly", e.getCause());
        }
    }

    private void settle(String workflowId, TaskOutcome outcome, Map<String, TaskState> states,
                        Map<String, String> outputs, List<WorkflowResult.TaskFailure> failures,
                        TaskResultListener listener) {
        states.put(outcome.taskId(), outcome.state());
        if (outcome.succeeded()) {
            outputs.put(outcome.taskId(), outcome.output() == null ? "" : outcome.output());
        } else {
            failures.add(new WorkflowResult.TaskFailure(outcome.taskId(), outcome.failureReason()));
        }
        eventBus.publish(RoutemindEvent.of(outcome.succeeded() ? "task.completed" : "task.failed",
                workflowId, outcome.taskId(), eventPayload(outcome)));
        try {
            listener.onTaskResult(workflowId, outcome);
        } catch (Exception e) {
            log.warn("Result listener threw for task {}: {}", outcome.taskId(), e.getMessage(), e);
        }
    }

    private TaskOutcome runTask(String workflowId, Task task, Map<String, Object> context,
                                Map<String, TaskState> states, CancellationToken token) {
        MdcContext.setTask(workflowId, task.id());
        long startMs = System.currentTimeMillis();
        try {
            if (token.isCancelled()) {
                return TaskOutcome.failed(task.id(), task.type(), null, "cancelled", 0, 0);
            }
            states.put(task.id(), TaskState.RUNNING);
            eventBus.publish(RoutemindEvent.of("task.started", workflowId, task.id(),
                    Map.of("type", task.type().tag())));
            TaskOutcome outcome = attempt(task, context, token, startMs);
            if (metrics != null) {
                metrics.recordTaskAttempts(task.type().tag(), outcome.attempts());
                metrics.recordTaskExecution(task.type().tag(),
                        outcome.backend() == null ? "none" : outcome.backend(),
                        outcome.durationMs(), outcome.succeeded());
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Task {} failed with unexpected error: {}", task.id(), e.getMessage(), e);
            return TaskOutcome.failed(task.id(), task.type(), null, "internal error: " + e.getMessage(), 0,
                    System.currentTimeMillis() - startMs);
        } finally {
            MdcContext.clear();
        }
    }

    private TaskOutcome attempt(Task task, Map<String, Object> context, CancellationToken token, long startMs) {
        var complexity = classifier.classify(task.prompt()).complexity();
        RoutingDecision decision = router.route(task.type(), complexity, 1.0);
        if (!decision.available()) {
            var failure = new NoHealthyBackendException(decision.reason());
            log.warn("Task {} not routable: {}", task.id(), failure.getMessage());
            return TaskOutcome.failed(task.id(), task.type(), null, failure.getMessage(), 0,
                    System.currentTimeMillis() - startMs);
        }

        var candidates = new ArrayDeque<String>();
        candidates.add(decision.backend());
        candidates.addAll(decision.fallbacks());
        Set<String> excluded = new HashSet<>();
        Set<String> requeued = new HashSet<>();
        int attempts = 0;
        String lastBackend = null;
        String lastError = "no routable candidate";

        while (!candidates.isEmpty() && attempts < settings.maxAttempts()) {
            if (token.isCancelled()) {
                return TaskOutcome.failed(task.id(), task.type(), lastBackend, "cancelled", attempts,
                        System.currentTimeMillis() - startMs);
            }
            String name = candidates.poll();
            if (excluded.contains(name)) continue;
            var snapshot = router.registry().get(name);
            if (snapshot.isEmpty() || !router.isRoutable(snapshot.get())) {
                log.debug("Skipping {} for task {}: not routable", name, task.id());
                continue;
            }
            Duration timeout = settings.attemptTimeout(snapshot.get().averageLatencySeconds());
            attempts++;
            lastBackend = name;
            MdcContext.setBackend(name);
            long callStart = System.nanoTime();
            try {
                String output = invoke(new InvocationRequest(snapshot.get().descriptor(), task.prompt(), context,
                        timeout, token::isCancelled), timeout);
                router.reportOutcome(name, seconds(callStart), true);
                log.info("Task {} [{}] done on {} (attempt {})", task.id(), task.type().tag(), name, attempts);
                return TaskOutcome.done(task.id(), task.type(), name, output, attempts,
                        System.currentTimeMillis() - startMs);
            } catch (BackendTimeoutException e) {
                router.reportOutcome(name, seconds(callStart), false);
                lastError = name + ": " + e.getMessage();
                if (requeued.add(name)) {
                    candidates.addLast(name);
                }
                log.warn("Task {} timed out on {} after {}ms", task.id(), name, timeout.toMillis());
            } catch (BackendInvocationException e) {
                router.reportOutcome(name, seconds(callStart), false);
                lastError = name + ": " + e.getMessage();
                excluded.add(name);
                log.warn("Task {} failed on {}: {}", task.id(), name, e.getMessage());
            } finally {
                MdcContext.clearBackend();
            }
        }
        String reason = attempts >= settings.maxAttempts()
                ? "attempts exhausted (" + attempts + "), last error " + lastError
                : "fallbacks exhausted, last error " + lastError;
        return TaskOutcome.failed(task.id(), task.type(), lastBackend, reason, attempts,
                System.currentTimeMillis() - startMs);
    }

    private String invoke(InvocationRequest request, Duration timeout) throws BackendInvocationException {
        String backend = request.backend().name();
        Future<String> call = invocations.submit(() -> invoker.invoke(request));
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new BackendTimeoutException(backend, "no answer within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendInvocationException bie) {
                throw bie;
            }
            throw new BackendErrorException(backend, "invoker error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendErrorException(backend, "interrupted while waiting for backend", e);
        }
    }

    private static Map<String, Object> dependencyContext(Task task, Map<String, String> outputs) {
        var context = new LinkedHashMap<String, Object>(task.context());
        for (String dep : task.dependencies()) {
            context.put("dependency." + dep, outputs.get(dep));
        }
        return context;
    }

    private static Map<String, Object> eventPayload(TaskOutcome outcome) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("type", outcome.type().tag());
        payload.put("state", outcome.state().name());
        payload.put("attempts", outcome.attempts());
        if (outcome.backend() != null) payload.put("backend", outcome.backend());
        if (outcome.failureReason() != null) payload.put("reason", outcome.failureReason());
        return payload;
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static void validateGraph(List<Task> tasks) {
        var ids = new HashSet<String>();
        for (Task task : tasks) {
            if (!ids.add(task.id())) {
                throw new IllegalArgumentException("Duplicate task id: " + task.id());
            }
        }
        for (Task task : tasks) {
            for (String dep : task.dependencies()) {
                if (!ids.contains(dep)) {
                    throw new IllegalArgumentException("Task " + task.id() + " depends on unknown task " + dep);
                }
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
