package com.lorasim.dispatch.cli;

import com.lorasim.core.engine.SimulationEngine;
import com.lorasim.core.engine.SimulationPlan;
import com.lorasim.core.engine.SimulationProperties;
import com.lorasim.core.engine.SimulationReport;
import com.lorasim.core.engine.SimulationReportWriter;
import com.lorasim.core.events.LineSink;
import com.lorasim.core.events.PrintStreamLineSink;
import com.lorasim.core.scheduler.StopSignal;
import com.lorasim.core.timeline.TimelineException;
import com.lorasim.node.SpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: lorasim run --input &lt;timeline&gt;
 * <p>
 * Spawns one process per node, replays the timeline against them, echoes the
 * event log to stdout and prints every node's final state once the run stops.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a simulation from a timeline file")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    /** How long the shutdown hook lets the run drain before the JVM exits. */
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private static final Signal SIGINT = new Signal("INT");

    @Option(names = {"--input", "-i"}, required = true, description = "Timeline file (ts,destination,payload)")
    private Path input;

    @Option(names = "--nodes", arity = "1..*", description = "Node names, in matrix order")
    private List<String> nodes;

    @Option(names = "--node-exe", description = "Node program started once per node")
    private Path nodeExe;

    @Option(names = "--outdir", description = "Directory for sim_output.log and per-node logs")
    private Path outdir;

    @Option(names = "--duration", description = "Seconds to run after spawning; default waits for cancellation")
    private Double duration;

    @Option(names = "--spawn-offsets", arity = "1..*", description = "Explicit spawn offset per node, in seconds")
    private List<Double> spawnOffsets;

    @Option(names = "--spawn-max", description = "Upper bound of random spawn offsets, in seconds")
    private Double spawnMax;

    @Option(names = "--seed", description = "Seed for random spawn offsets")
    private Long seed;

    @Option(names = "--query-timeout", paramLabel = "MS", description = "Final state query timeout in milliseconds")
    private Long queryTimeoutMs;

    @Option(names = "--quiet", description = "Do not echo the event log to stdout")
    private boolean quiet;

    @Option(names = "--stop-at-timeline-end", description = "Stop once every timeline event has been applied")
    private Boolean stopAtTimelineEnd;

    private final SimulationEngine simulationEngine;
    private final SimulationProperties properties;
    private final SimulationReportWriter reportWriter;

    public RunCommand(SimulationEngine simulationEngine, SimulationProperties properties,
                      SimulationReportWriter reportWriter) {
        this.simulationEngine = simulationEngine;
        this.properties = properties;
        this.reportWriter = reportWriter;
    }

    @Override
    public Integer call() {
        SimulationPlan plan;
        try {
            plan = buildPlan();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid arguments: " + e.getMessage());
            return 1;
        }

        boolean echo = !quiet && properties.isEchoEvents();
        if (echo) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Nodes: " + String.join(", ", plan.nodeNames()) + " | program: " + plan.executable());
        }

        var stopSignal = new StopSignal();
        var done = new CountDownLatch(1);
        Optional<SignalHandler> previousInterruptHandler = handleInterrupt(stopSignal);
        // SIGTERM and other JVM shutdowns still drain through the hook
        Thread hook = shutdownHook(stopSignal, done);
        Runtime.getRuntime().addShutdownHook(hook);
        Optional<ConsoleStopListener> stopListener = ConsoleStopListener.startOnTerminal(stopSignal);
        if (stopListener.isPresent() && echo) {
            ConsoleOutput.info("Press ESC or q to stop the simulation");
        }

        List<LineSink> sinks = echo ? List.of(new PrintStreamLineSink(System.out)) : List.of();
        try {
            SimulationReport report = simulationEngine.run(plan, stopSignal, sinks);
            ConsoleOutput.finalStates(report);
            reportWriter.write(report, plan.outdir());
            return 0;
        } catch (SpawnException e) {
            ConsoleOutput.error("Failed to start node " + e.getNodeName() + ": " + rootCauseMessage(e));
            return 1;
        } catch (TimelineException e) {
            ConsoleOutput.error("Cannot read timeline: " + rootCauseMessage(e));
            return 1;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid arguments: " + e.getMessage());
            return 1;
        } catch (UncheckedIOException e) {
            ConsoleOutput.error("Cannot write logs: " + rootCauseMessage(e));
            return 1;
        } finally {
            stopListener.ifPresent(ConsoleStopListener::close);
            done.countDown();
            removeShutdownHook(hook);
            previousInterruptHandler.ifPresent(previous -> Signal.handle(SIGINT, previous));
        }
    }

    SimulationPlan buildPlan() {
        var builder = SimulationPlan.builder(properties).input(input);
        if (nodes != null) {
            builder.nodeNames(nodes);
        }
        if (nodeExe != null) {
            builder.executable(nodeExe);
        }
        if (outdir != null) {
            builder.outdir(outdir);
        }
        if (duration != null) {
            builder.durationSeconds(duration);
        }
        if (spawnOffsets != null) {
            builder.spawnOffsets(spawnOffsets);
        }
        if (spawnMax != null) {
            builder.spawnMaxSeconds(spawnMax);
        }
        if (seed != null) {
            builder.seed(seed);
        }
        if (queryTimeoutMs != null) {
            builder.queryTimeout(Duration.ofMillis(queryTimeoutMs));
        }
        if (stopAtTimelineEnd != null) {
            builder.stopWhenTimelineCompletes(stopAtTimelineEnd);
        }
        return builder.build();
    }

    /**
     * Turns Ctrl-C into an ordinary stop so the run drains and exits with 0.
     *
     * @return the handler to restore once the run is over, empty when SIGINT cannot be handled
     */
    private static Optional<SignalHandler> handleInterrupt(StopSignal stopSignal) {
        try {
            return Optional.of(Signal.handle(SIGINT, signal -> {
                if (stopSignal.stop(StopSignal.Reason.INTERRUPTED)) {
                    log.info("Interrupted, draining nodes");
                }
            }));
        } catch (IllegalArgumentException e) {
            log.debug("SIGINT not available to the application: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Thread shutdownHook(StopSignal stopSignal, CountDownLatch done) {
        return new Thread(() -> {
            if (stopSignal.stop(StopSignal.Reason.INTERRUPTED)) {
                log.info("Interrupted, draining nodes before exit");
            }
            try {
                if (!done.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Simulation did not drain within {}s", SHUTDOWN_GRACE.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "lorasim-shutdown");
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            log.debug("Shutdown in progress, hook left registered");
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
