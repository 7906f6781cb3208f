package com.routemind.core.health;

import com.routemind.core.model.BackendSnapshot;
import com.routemind.core.registry.BackendHealthMonitor;
import com.routemind.core.routing.BackendRouter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarizes the health of the service from the registry's cached backend states.
 */
@Service
public class HealthCheckService {

    private final BackendRouter router;
    private final BackendHealthMonitor monitor;

    public HealthCheckService(BackendRouter router, BackendHealthMonitor monitor) {
        this.router = router;
        this.monitor = monitor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBackends());
        results.add(checkMonitor());
        return results;
    }

    /**
     * UP when every backend is routable, DEGRADED when only some are, DOWN when none
     * are or no backend is registered.
     */
    HealthStatus checkBackends() {
        List<BackendSnapshot> backends = router.registry().listAll();
        if (backends.isEmpty()) {
            return new HealthStatus("backends", HealthStatus.Status.DOWN, "No backends registered", Map.of());
        }
        var metadata = new LinkedHashMap<String, String>();
        int routable = 0;
        for (BackendSnapshot backend : backends) {
            metadata.put(backend.name(), backend.health().status().name());
            if (router.isRoutable(backend)) routable++;
        }
        String detail = routable + " of " + backends.size() + " backend(s) routable";
        HealthStatus.Status status;
        if (routable == backends.size()) {
            status = HealthStatus.Status.UP;
        } else if (routable > 0) {
            status = HealthStatus.Status.DEGRADED;
        } else {
            status = HealthStatus.Status.DOWN;
        }
        return new HealthStatus("backends", status, detail, metadata);
    }

    private HealthStatus checkMonitor() {
        if (!monitor.isEnabled()) {
            return new HealthStatus("health-monitor", HealthStatus.Status.DEGRADED,
                    "Periodic probing disabled", Map.of());
        }
        return new HealthStatus("health-monitor", HealthStatus.Status.UP,
                "Probing every " + monitor.getIntervalSeconds() + "s", Map.of());
    }
}
