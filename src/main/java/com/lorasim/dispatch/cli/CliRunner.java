package com.lorasim.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

/**
 * Runs the picocli command tree inside the Spring context and hands its exit code
 * back to Spring Boot. Failures nobody anticipated are reported on one console line;
 * the stack trace goes to the log.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final LorasimCommand lorasimCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LorasimCommand lorasimCommand, IFactory factory) {
        this.lorasimCommand = lorasimCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(lorasimCommand, factory)
                .setExecutionExceptionHandler(this::reportFailure)
                .execute(args);
    }

    private int reportFailure(Exception e, CommandLine commandLine, ParseResult parseResult) {
        String command = commandLine.getCommandName();
        log.error("{} failed", command, e);
        ConsoleOutput.error(command + " failed: " + e.getMessage());
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
