package com.routemind.dispatch.api;

import com.routemind.core.engine.WorkflowEngine;
import com.routemind.core.engine.WorkflowRun;
import com.routemind.core.model.Task;
import com.routemind.core.model.WorkflowPlan;
import com.routemind.core.model.WorkflowTemplate;
import com.routemind.core.workflow.UnknownTemplateException;
import com.routemind.core.workflow.WorkflowGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for workflow templates, planning and execution.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowEngine engine;
    private final WorkflowGraphBuilder graphBuilder;
    private final WorkflowEventStreamService eventStreams;

    public WorkflowController(WorkflowEngine engine, WorkflowGraphBuilder graphBuilder,
                              WorkflowEventStreamService eventStreams) {
        this.engine = engine;
        this.graphBuilder = graphBuilder;
        this.eventStreams = eventStreams;
    }

    /**
     * GET /api/v1/workflows/templates: Available templates in catalog order.
     */
    @GetMapping("/templates")
    public ResponseEntity<List<Map<String, Object>>> listTemplates() {
        return ResponseEntity.ok(graphBuilder.listTemplates().stream()
                .map(WorkflowController::toResponse)
                .toList());
    }

    /**
     * POST /api/v1/workflows/plan: Build the task graph without running it.
     */
    @PostMapping("/plan")
    public ResponseEntity<Map<String, Object>> plan(@RequestBody WorkflowRequest request) {
        try {
            WorkflowPlan plan = engine.plan(request.prompt(), request.template(), request.context());
            var body = new LinkedHashMap<String, Object>();
            body.put("template", plan.templateKey());
            body.put("parallelGroups", plan.parallelGroupCount());
            body.put("tasks", plan.tasks().stream().map(WorkflowController::toResponse).toList());
            return ResponseEntity.ok(body);
        } catch (UnknownTemplateException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/workflows: Submit a workflow. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody WorkflowRequest request) {
        try {
            String workflowId = engine.submit(request.prompt(), request.template(), request.context());
            log.info("Accepted workflow {}", workflowId);
            return ResponseEntity.accepted().body(Map.of(
                    "workflowId", workflowId,
                    "status", "RUNNING"));
        } catch (UnknownTemplateException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/workflows/{id}: Current status, per-task states and, once finished, outputs.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        return engine.status(id)
                .map(run -> ResponseEntity.ok(toResponse(run)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/workflows/{id}/events: SSE stream of task and workflow events until the run finishes.
     * 409 when the run has already finished.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        var run = engine.status(id);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (run.get().isFinished()) {
            return ResponseEntity.status(409).build();
        }
        return ResponseEntity.ok(eventStreams.open(id));
    }

    /**
     * DELETE /api/v1/workflows/{id}: Request cancellation. 409 when the run has already finished.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        var run = engine.status(id);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (run.get().isFinished()) {
            return ResponseEntity.status(409).body(Map.of(
                    "workflowId", id,
                    "error", "Workflow already finished with status " + run.get().status()));
        }
        boolean cancelled = engine.cancel(id);
        return ResponseEntity.accepted().body(Map.of(
                "workflowId", id,
                "cancelRequested", cancelled));
    }

    private static Map<String, Object> toResponse(WorkflowTemplate template) {
        var body = new LinkedHashMap<String, Object>();
        body.put("key", template.key());
        body.put("name", template.name());
        body.put("description", template.description());
        body.put("taskTypes", template.taskTypes().stream().map(t -> t.tag()).toList());
        body.put("keywords", template.keywords());
        body.put("estimatedDurationSeconds", template.estimatedDurationSeconds());
        return body;
    }

    private static Map<String, Object> toResponse(Task task) {
        var body = new LinkedHashMap<String, Object>();
        body.put("id", task.id());
        body.put("type", task.type().tag());
        body.put("prompt", task.prompt());
        body.put("dependencies", task.dependencies());
        body.put("parallelGroup", task.parallelGroup());
        return body;
    }

    private static Map<String, Object> toResponse(WorkflowRun run) {
        var body = new LinkedHashMap<String, Object>();
        body.put("workflowId", run.workflowId());
        body.put("template", run.templateKey());
        body.put("status", run.status().name());
        body.put("submittedAt", run.submittedAt().toString());
        body.put("finishedAt", run.finishedAt() == null ? null : run.finishedAt().toString());
        var tasks = new LinkedHashMap<String, Object>();
        run.taskStates().forEach((id, state) -> tasks.put(id, state.name()));
        body.put("tasks", tasks);
        if (run.result() != null) {
            body.put("outputs", run.result().outputs());
            body.put("failures", run.result().failures());
            body.put("durationMs", run.result().durationMs());
        }
        return body;
    }
}
