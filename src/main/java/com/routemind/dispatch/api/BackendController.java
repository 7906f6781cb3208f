package com.routemind.dispatch.api;

import com.routemind.core.model.BackendSnapshot;
import com.routemind.core.routing.BackendAnalytics;
import com.routemind.core.routing.BackendRouter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing the backend registry and routing analytics.
 */
@RestController
@RequestMapping("/api/v1/backends")
public class BackendController {

    private final BackendRouter router;

    public BackendController(BackendRouter router) {
        this.router = router;
    }

    /**
     * GET /api/v1/backends: Registered backends with their cached health, in registration order.
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listBackends() {
        return ResponseEntity.ok(router.registry().listAll().stream()
                .map(this::toResponse)
                .toList());
    }

    /**
     * GET /api/v1/backends/analytics: Routed and reported counts, success rate and latency per backend.
     */
    @GetMapping("/analytics")
    public ResponseEntity<BackendAnalytics> analytics() {
        return ResponseEntity.ok(router.analytics());
    }

    private Map<String, Object> toResponse(BackendSnapshot snapshot) {
        var d = snapshot.descriptor();
        var h = snapshot.health();
        var body = new LinkedHashMap<String, Object>();
        body.put("name", d.name());
        body.put("endpoint", d.endpoint());
        body.put("wireFormat", d.wireFormat().tag());
        body.put("backendType", d.backendType());
        body.put("description", d.description());
        body.put("specialties", d.specialties());
        body.put("maxComplexity", d.maxComplexity().tag());
        body.put("costPerToken", d.costPerToken());
        body.put("performanceScore", d.performanceScore());
        body.put("fallbackChain", d.fallbackChain());
        body.put("status", h.status().name());
        body.put("routable", router.isRoutable(snapshot));
        body.put("consecutiveFailures", h.consecutiveFailures());
        body.put("averageLatencySeconds", h.averageLatencySeconds());
        body.put("lastChecked", h.lastChecked() == null ? null : h.lastChecked().toString());
        body.put("lastProbeDetail", h.lastProbeDetail());
        return body;
    }
}
