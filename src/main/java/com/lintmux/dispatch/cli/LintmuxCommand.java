package com.lintmux.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Lintmux.
 * Routes to subcommands: serve, discover, health.
 */
@Command(
        name = "lintmux",
        mixinStandardHelpOptions = true,
        version = "Lintmux 0.1.0",
        description = "Multiplexes one analysis host onto the analysis plugins of its workspaces",
        subcommands = {
                ServeCommand.class,
                DiscoverCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LintmuxCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
