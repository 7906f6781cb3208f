package com.routemind.dispatch.cli;

import com.routemind.core.routing.BackendRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: routemind backends
 */
@Command(name = "backends", mixinStandardHelpOptions = true, description = "List registered backends")
@Component
public class BackendsCommand implements Runnable {

    @Option(names = {"--specialty", "-s"}, description = "Only backends with this specialty")
    private String specialty;

    private final BackendRouter router;

    public BackendsCommand(BackendRouter router) {
        this.router = router;
    }

    @Override
    public void run() {
        var backends = specialty == null
                ? router.registry().listAll()
                : router.registry().findBySpecialty(specialty);
        if (backends.isEmpty()) {
            ConsoleOutput.info("No backends registered" + (specialty == null ? "" : " for specialty " + specialty));
            return;
        }
        for (var b : backends) {
            var d = b.descriptor();
            ConsoleOutput.backend(d.name(), b.health().status(), String.format("%s ceiling=%s latency=%.2fs specialties=%s%s",
                    d.endpoint(), d.maxComplexity().tag(), b.averageLatencySeconds(),
                    String.join(",", d.specialties()),
                    d.fallbackChain().isEmpty() ? "" : " fallbacks=" + String.join(",", d.fallbackChain())));
        }
    }
}
