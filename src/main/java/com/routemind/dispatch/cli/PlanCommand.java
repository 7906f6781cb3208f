package com.routemind.dispatch.cli;

import com.routemind.core.engine.WorkflowEngine;
import com.routemind.core.model.WorkflowPlan;
import com.routemind.core.workflow.UnknownTemplateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: routemind plan "&lt;prompt&gt;" [--template key]
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the task graph a workflow would run")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow prompt")
    private String prompt;

    @Option(names = {"--template", "-t"}, description = "Template key; inferred from the prompt when omitted")
    private String template;

    private final WorkflowEngine engine;

    public PlanCommand(WorkflowEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        WorkflowPlan plan;
        try {
            plan = engine.plan(prompt, template, Map.of());
        } catch (UnknownTemplateException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.info("Template: " + plan.templateKey() + " | " + plan.tasks().size()
                + " task(s), " + plan.parallelGroupCount() + " parallel group(s)");
        System.out.println();
        for (var task : plan.tasks()) {
            System.out.printf("  %-28s [%-9s]%s%s%n", task.id(), task.type().tag(),
                    task.dependencies().isEmpty() ? "" : " after " + String.join(", ", task.dependencies()),
                    task.parallelGroup() == null ? "" : " group " + task.parallelGroup());
        }
        return 0;
    }
}
