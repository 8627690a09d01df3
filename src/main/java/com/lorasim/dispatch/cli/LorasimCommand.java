package com.lorasim.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Lorasim.
 * Routes to subcommands: run, check.
 */
@Command(
        name = "lorasim",
        mixinStandardHelpOptions = true,
        version = "Lorasim 0.1.0",
        description = "Discrete-event LoRa mesh simulator driving one process per node",
        subcommands = {
                RunCommand.class,
                CheckCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LorasimCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
