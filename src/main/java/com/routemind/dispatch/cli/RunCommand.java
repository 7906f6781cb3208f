package com.routemind.dispatch.cli;

import com.routemind.core.engine.WorkflowEngine;
import com.routemind.core.execution.WorkflowResult;
import com.routemind.core.model.WorkflowStatus;
import com.routemind.core.workflow.UnknownTemplateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: routemind run "&lt;prompt&gt;" [--template key]
 * <p>
 * Runs a workflow to completion, printing each task result as it arrives.
 * Exit code 0 when every task completed, 3 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow against the configured backends")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow prompt")
    private String prompt;

    @Option(names = {"--template", "-t"}, description = "Template key; inferred from the prompt when omitted")
    private String template;

    @Option(names = "--show-output", description = "Print each task's output")
    private boolean showOutput;

    private final WorkflowEngine engine;

    public RunCommand(WorkflowEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        WorkflowResult result;
        try {
            result = engine.run(prompt, template, Map.of(),
                    (workflowId, outcome) -> ConsoleOutput.taskResult(outcome));
        } catch (UnknownTemplateException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println("──────────────────────────────────");
        String summary = String.format("Workflow %s %s in %s (%d done, %d failed)", result.workflowId(),
                result.status(), ConsoleOutput.formatDuration(result.durationMs()),
                result.outputs().size(), result.failures().size());
        if (result.status() == WorkflowStatus.COMPLETED) {
            ConsoleOutput.success(summary);
        } else {
            ConsoleOutput.error(summary);
        }
        if (showOutput) {
            result.outputs().forEach((taskId, output) -> {
                System.out.println();
                System.out.println("== " + taskId);
                System.out.println(output);
            });
        }
        return result.status() == WorkflowStatus.COMPLETED ? 0 : 3;
    }
}
