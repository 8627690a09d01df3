package com.lorasim.dispatch.cli;

import com.lorasim.core.engine.SimulationProperties;
import com.lorasim.core.health.PreflightCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lorasim check --input &lt;timeline&gt;
 * <p>
 * Verifies the node program, the output directory and the timeline without
 * starting any node.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Check that a simulation can start")
@Component
public class CheckCommand implements Callable<Integer> {

    @Option(names = {"--input", "-i"}, required = true, description = "Timeline file to validate")
    private Path input;

    @Option(names = "--nodes", arity = "1..*", description = "Node names the timeline should address")
    private List<String> nodes;

    @Option(names = "--node-exe", description = "Node program to check")
    private Path nodeExe;

    @Option(names = "--outdir", description = "Output directory to check")
    private Path outdir;

    private final PreflightCheckService preflightCheckService;
    private final SimulationProperties properties;

    public CheckCommand(PreflightCheckService preflightCheckService, SimulationProperties properties) {
        this.preflightCheckService = preflightCheckService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = preflightCheckService.checkAll(
                nodeExe != null ? nodeExe : Path.of(properties.getExecutable()),
                outdir != null ? outdir : Path.of(properties.getOutdir()),
                input,
                nodes != null ? nodes : properties.getNodeNames());

        boolean allUp = true;
        for (var check : checks) {
            ConsoleOutput.check(check);
            if (!check.isUp()) {
                allUp = false;
            }
        }

        System.out.println(ConsoleOutput.SEPARATOR);
        if (allUp) {
            ConsoleOutput.success("Ready to run");
            return 0;
        }
        ConsoleOutput.error("One or more checks failed");
        return 1;
    }
}
