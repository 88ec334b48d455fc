package com.topostat.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Topostat.
 * Routes to subcommands: serve, submit, stats, health.
 */
@Command(
        name = "topostat",
        mixinStandardHelpOptions = true,
        version = "Topostat 0.1.0",
        description = "CI test result collection and statistics",
        subcommands = {
                ServeCommand.class,
                SubmitCommand.class,
                StatsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TopostatCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
