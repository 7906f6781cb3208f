package com.routemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Routemind.
 */
@Command(
        name = "routemind",
        mixinStandardHelpOptions = true,
        version = "Routemind 0.1.0",
        description = "Routes prompts to model backends and runs multi-agent workflows",
        subcommands = {
                ClassifyCommand.class,
                RouteCommand.class,
                PlanCommand.class,
                RunCommand.class,
                BackendsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RoutemindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
