package com.routemind.core.engine;

import com.routemind.core.config.RoutemindProperties;
import com.routemind.core.events.EventBus;
import com.routemind.core.events.RoutemindEvent;
import com.routemind.core.execution.CancellationToken;
import com.routemind.core.execution.TaskGraphExecutor;
import com.routemind.core.execution.TaskResultListener;
import com.routemind.core.execution.WorkflowResult;
import com.routemind.core.logging.MdcContext;
import com.routemind.core.metrics.RoutemindMetrics;
import com.routemind.core.model.Task;
import com.routemind.core.model.TaskState;
import com.routemind.core.model.WorkflowPlan;
import com.routemind.core.model.WorkflowStatus;
import com.routemind.core.workflow.WorkflowGraphBuilder;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running workflows: builds the task graph from a template and hands
 * it to the {@link TaskGraphExecutor}, either synchronously or in the background.
 * <p>
 * Submitted runs are kept in memory; once more than {@code routemind.engine.max-history}
 * runs are held, the oldest finished ones are evicted. At most
 * {@code routemind.engine.max-concurrent-workflows} submitted runs execute at once; the rest queue
 * with every task still PENDING.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);
    private static final AtomicInteger WORKFLOW_COUNTER = new AtomicInteger(0);
    private static final String TASK_STARTED = "task.started";

    private final WorkflowGraphBuilder graphBuilder;
    private final TaskGraphExecutor executor;
    private final EventBus eventBus;
    private final RoutemindMetrics metrics;
    private final int maxHistory;

    private final Map<String, RunRecord> runs = new LinkedHashMap<>();
    private final ExecutorService runner;

    @Autowired
    public WorkflowEngine(WorkflowGraphBuilder graphBuilder, TaskGraphExecutor executor, EventBus eventBus,
                          RoutemindMetrics metrics, RoutemindProperties properties) {
        this(graphBuilder, executor, eventBus, metrics, properties.getMaxHistory(),
                properties.getMaxConcurrentWorkflows());
    }

    WorkflowEngine(WorkflowGraphBuilder graphBuilder, TaskGraphExecutor executor, EventBus eventBus,
                   RoutemindMetrics metrics, int maxHistory, int maxConcurrentWorkflows) {
        this.graphBuilder = graphBuilder;
        this.executor = executor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxHistory = maxHistory;
        AtomicInteger threadIndex = new AtomicInteger();
        this.runner = Executors.newFixedThreadPool(Math.max(1, maxConcurrentWorkflows), r -> {
            Thread t = new Thread(r, "workflow-runner-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        synchronized (runs) {
            runs.values().forEach(r -> r.token.cancel());
        }
        runner.shutdownNow();
    }

    /**
     * Builds the task graph without running it.
     *
     * @throws com.routemind.core.workflow.UnknownTemplateException if the key is given but unknown
     */
    public WorkflowPlan plan(String prompt, String templateKey, Map<String, Object> context) {
        requirePrompt(prompt);
        return graphBuilder.plan(templateKey, prompt, context);
    }

    /**
     * Builds the graph and starts it in the background.
     *
     * @return the new workflow id
     */
    public String submit(String prompt, String templateKey, Map<String, Object> context) {
        WorkflowPlan plan = plan(prompt, templateKey, context);
        RunRecord record = register(prompt, plan);
        CompletableFuture.runAsync(() -> execute(record), runner);
        return record.workflowId;
    }

    /**
     * Builds the graph and runs it on the calling thread.
     */
    public WorkflowResult run(String prompt, String templateKey, Map<String, Object> context,
                              TaskResultListener listener) {
        WorkflowPlan plan = plan(prompt, templateKey, context);
        RunRecord record = register(prompt, plan);
        record.extraListener = listener == null ? TaskResultListener.NONE : listener;
        return execute(record);
    }

    public Optional<WorkflowRun> status(String workflowId) {
        synchronized (runs) {
            RunRecord record = runs.get(workflowId);
            return record == null ? Optional.empty() : Optional.of(record.snapshot());
        }
    }

    public List<WorkflowRun> list() {
        synchronized (runs) {
            var result = new ArrayList<WorkflowRun>();
            runs.values().forEach(r -> result.add(r.snapshot()));
            return result;
        }
    }

    /**
     * Requests cooperative cancellation.
     *
     * @return false if the id is unknown, the run already finished, or it was already cancelled
     */
    public boolean cancel(String workflowId) {
        RunRecord record;
        synchronized (runs) {
            record = runs.get(workflowId);
        }
        if (record == null || record.result != null) {
            return false;
        }
        boolean cancelled = record.token.cancel();
        if (cancelled) {
            log.info("Cancellation requested for workflow {}", workflowId);
            eventBus.publish(RoutemindEvent.of("workflow.cancel_requested", workflowId, null, Map.of()));
        }
        return cancelled;
    }

    /**
     * Generates a workflow id in the format WF-YYYY-NNNN.
     */
    public String generateWorkflowId() {
        int count = WORKFLOW_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("WF-%d-%04d", year, count);
    }

    private RunRecord register(String prompt, WorkflowPlan plan) {
        var record = new RunRecord(generateWorkflowId(), prompt, plan);
        synchronized (runs) {
            runs.put(record.workflowId, record);
            evictFinished();
        }
        eventBus.publish(RoutemindEvent.of("workflow.created", record.workflowId, null,
                Map.of("template", plan.templateKey(), "tasks", plan.tasks().size())));
        return record;
    }

    private WorkflowResult execute(RunRecord record) {
        MdcContext.setWorkflow(record.workflowId);
        try {
            log.info("Starting workflow {} from template {} with {} task(s)", record.workflowId,
                    record.plan.templateKey(), record.plan.tasks().size());
            TaskResultListener listener = (workflowId, outcome) -> {
                record.taskStates.put(outcome.taskId(), outcome.state());
                record.extraListener.onTaskResult(workflowId, outcome);
            };
            EventBus.Subscription started = eventBus.subscribe(record.workflowId, event -> {
                if (TASK_STARTED.equals(event.eventType()) && event.taskId() != null) {
                    record.markRunning(event.taskId());
                }
            });
            WorkflowResult result;
            try {
                result = executor.execute(record.workflowId, record.plan.tasks(), listener, record.token);
            } finally {
                started.unsubscribe();
            }
            record.finish(result);
            if (metrics != null) {
                metrics.recordWorkflowResult(result.status().name());
            }
            eventBus.publish(RoutemindEvent.of("workflow.finished", record.workflowId, null,
                    Map.of("status", result.status().name(), "failures", result.failures().size())));
            return result;
        } catch (RuntimeException e) {
            log.error("Workflow {} aborted: {}", record.workflowId, e.getMessage(), e);
            var failed = new WorkflowResult(record.workflowId, WorkflowStatus.FAILED, Map.copyOf(record.taskStates),
                    Map.of(), List.of(new WorkflowResult.TaskFailure("*", "aborted: " + e.getMessage())), 0);
            record.finish(failed);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private void evictFinished() {
        Iterator<RunRecord> it = runs.values().iterator();
        while (runs.size() > maxHistory && it.hasNext()) {
            if (it.next().result != null) {
                it.remove();
            }
        }
    }

    private static void requirePrompt(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
    }

    private static final class RunRecord {
        final String workflowId;
        final String prompt;
        final WorkflowPlan plan;
        final Instant submittedAt = Instant.now();
        final CancellationToken token = new CancellationToken();
        final Map<String, TaskState> taskStates = Collections.synchronizedMap(new LinkedHashMap<>());
        volatile TaskResultListener extraListener = TaskResultListener.NONE;
        volatile WorkflowResult result;
        volatile Instant finishedAt;

        RunRecord(String workflowId, String prompt, WorkflowPlan plan) {
            this.workflowId = workflowId;
            this.prompt = prompt;
            this.plan = plan;
            for (Task task : plan.tasks()) {
                taskStates.put(task.id(), TaskState.PENDING);
            }
        }

        /** Only a PENDING task moves to RUNNING; a terminal state is never overwritten. */
        void markRunning(String taskId) {
            taskStates.computeIfPresent(taskId, (id, state) -> state == TaskState.PENDING ? TaskState.RUNNING : state);
        }

        void finish(WorkflowResult finalResult) {
            this.finishedAt = Instant.now();
            this.result = finalResult;
        }

        WorkflowRun snapshot() {
            WorkflowResult current = result;
            Map<String, TaskState> states;
            synchronized (taskStates) {
                states = Collections.unmodifiableMap(new LinkedHashMap<>(taskStates));
            }
            return new WorkflowRun(workflowId, plan.templateKey(), prompt,
                    current == null ? WorkflowStatus.RUNNING : current.status(),
                    states, submittedAt, finishedAt, current);
        }
    }
}
