package com.routemind.dispatch.cli;

import com.routemind.core.health.HealthCheckService;
import com.routemind.core.registry.BackendHealthMonitor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: routemind health [--probe]
 * <p>
 * Shows the cached health summary; with {@code --probe}, runs one probe round first.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check backend health")
@Component
public class HealthCommand implements Runnable {

    @Option(names = {"--probe", "-p"}, description = "Probe every backend before reporting")
    private boolean probe;

    private final HealthCheckService healthCheckService;
    private final BackendHealthMonitor monitor;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService,
                         @Autowired(required = false) BackendHealthMonitor monitor) {
        this.healthCheckService = healthCheckService;
        this.monitor = monitor;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }
        if (probe && monitor != null) {
            ConsoleOutput.info("Probing backends...");
            for (var b : monitor.probeNow()) {
                ConsoleOutput.backend(b.name(), b.health().status(), b.health().lastProbeDetail());
            }
            System.out.println();
        }

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all backends routable");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
