package com.routemind.dispatch.cli;

import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.RoutingDecision;
import com.routemind.core.model.TaskType;
import com.routemind.core.classifier.PromptClassifier;
import com.routemind.core.routing.BackendRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: routemind route "&lt;prompt&gt;"
 * <p>
 * Shows which backend a prompt would be sent to and why. Exit code 2 when no
 * backend is routable.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Show the routing decision for a prompt")
@Component
public class RouteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Prompt to route")
    private String prompt;

    @Option(names = {"--type", "-t"}, description = "Task type override (reasoning, coding, creative, research, ...)")
    private String taskType;

    @Option(names = {"--complexity", "-c"}, description = "Complexity override (simple, moderate, complex, expert)")
    private String complexity;

    @Option(names = {"--budget", "-b"}, description = "Budget factor scaling the cost term", defaultValue = "1.0")
    private double budget;

    @Option(names = "--scores", description = "Print the score of every backend")
    private boolean showScores;

    private final BackendRouter router;
    private final PromptClassifier classifier;

    public RouteCommand(BackendRouter router, PromptClassifier classifier) {
        this.router = router;
        this.classifier = classifier;
    }

    @Override
    public Integer call() {
        RoutingDecision decision;
        try {
            var classification = classifier.classify(prompt);
            TaskType type = taskType == null ? classification.taskType() : TaskType.fromTag(taskType);
            ComplexityLevel level = complexity == null ? classification.complexity() : ComplexityLevel.fromTag(complexity);
            decision = router.route(type, level, budget);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info(String.format("Task: %s / %s", decision.taskType().tag(), decision.complexity().tag()));
        if (!decision.available()) {
            ConsoleOutput.error(decision.reason());
        } else {
            ConsoleOutput.success(String.format("%s at %s (%s)", decision.backend(), decision.endpoint(),
                    decision.wireFormat().tag()));
            System.out.println("  Reason:    " + decision.reason());
            System.out.println("  Fallbacks: " + (decision.fallbacks().isEmpty() ? "-" : String.join(", ", decision.fallbacks())));
            System.out.printf("  Estimated: cost %.4f/token, latency %.2fs%n",
                    decision.estimatedCost(), decision.estimatedLatencySeconds());
        }
        if (showScores) {
            decision.scores().forEach((name, score) -> System.out.printf("  %-12s %.3f%n", name, score));
        }
        return decision.available() ? 0 : 2;
    }
}
