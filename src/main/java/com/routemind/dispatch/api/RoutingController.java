package com.routemind.dispatch.api;

import com.routemind.core.classifier.PromptClassifier;
import com.routemind.core.model.Classification;
import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.RoutingDecision;
import com.routemind.core.model.TaskType;
import com.routemind.core.routing.BackendRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for classification, routing decisions and outcome reporting.
 */
@RestController
@RequestMapping("/api/v1")
public class RoutingController {

    private static final Logger log = LoggerFactory.getLogger(RoutingController.class);

    private final PromptClassifier classifier;
    private final BackendRouter router;

    public RoutingController(PromptClassifier classifier, BackendRouter router) {
        this.classifier = classifier;
        this.router = router;
    }

    /**
     * POST /api/v1/classify: Classify a prompt.
     */
    @PostMapping("/classify")
    public ResponseEntity<Map<String, Object>> classify(@RequestBody ClassifyRequest request) {
        if (request.prompt() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "prompt is required"));
        }
        return ResponseEntity.ok(toResponse(classifier.classify(request.prompt())));
    }

    /**
     * POST /api/v1/route: Route a prompt, or an explicit task type and complexity.
     * An unavailable decision is still a 200: it is a normal routing outcome.
     */
    @PostMapping("/route")
    public ResponseEntity<Map<String, Object>> route(@RequestBody RouteRequest request) {
        double budget = request.budgetFactor() == null ? 1.0 : request.budgetFactor();
        try {
            RoutingDecision decision;
            if (request.taskType() != null && !request.taskType().isBlank()) {
                TaskType type = TaskType.fromTag(request.taskType());
                ComplexityLevel complexity;
                if (request.complexity() != null && !request.complexity().isBlank()) {
                    complexity = ComplexityLevel.fromTag(request.complexity());
                } else if (request.prompt() != null) {
                    complexity = classifier.estimateComplexity(request.prompt());
                } else {
                    complexity = ComplexityLevel.SIMPLE;
                }
                decision = router.route(type, complexity, budget);
            } else if (request.prompt() != null) {
                decision = router.route(request.prompt(), budget);
            } else {
                return ResponseEntity.badRequest().body(Map.of("error", "prompt or taskType is required"));
            }
            return ResponseEntity.ok(toResponse(decision));
        } catch (IllegalArgumentException e) {
            log.debug("Rejected route request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/route/outcomes: Report the latency and success of a call to a backend.
     */
    @PostMapping("/route/outcomes")
    public ResponseEntity<Map<String, Object>> reportOutcome(@RequestBody OutcomeRequest request) {
        if (request.backend() == null || request.latencySeconds() == null || request.success() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "backend, latencySeconds and success are required"));
        }
        if (router.registry().get(request.backend()).isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error", "Unknown backend: " + request.backend()));
        }
        try {
            router.reportOutcome(request.backend(), request.latencySeconds(), request.success());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        double average = router.registry().get(request.backend())
                .map(b -> b.averageLatencySeconds())
                .orElse(request.latencySeconds());
        return ResponseEntity.accepted().body(Map.of(
                "backend", request.backend(),
                "averageLatencySeconds", average));
    }

    static Map<String, Object> toResponse(Classification classification) {
        var body = new LinkedHashMap<String, Object>();
        body.put("complexity", classification.complexity().tag());
        body.put("taskType", classification.taskType().tag());
        body.put("defaulted", classification.defaulted());
        return body;
    }

    static Map<String, Object> toResponse(RoutingDecision decision) {
        var body = new LinkedHashMap<String, Object>();
        body.put("available", decision.available());
        body.put("backend", decision.backend());
        body.put("endpoint", decision.endpoint());
        body.put("wireFormat", decision.wireFormat() == null ? null : decision.wireFormat().tag());
        body.put("score", decision.score());
        body.put("reason", decision.reason());
        body.put("fallbacks", decision.fallbacks());
        body.put("estimatedCost", decision.estimatedCost());
        body.put("estimatedLatencySeconds", decision.estimatedLatencySeconds());
        body.put("taskType", decision.taskType().tag());
        body.put("complexity", decision.complexity().tag());
        body.put("scores", decision.scores());
        return body;
    }
}
