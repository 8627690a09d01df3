package com.lorasim.core.engine;

import com.lorasim.core.events.EventLog;
import com.lorasim.core.events.FileLineSink;
import com.lorasim.core.events.LineSink;
import com.lorasim.core.events.SimulationClock;
import com.lorasim.core.events.SimulationEvent;
import com.lorasim.core.logging.MdcContext;
import com.lorasim.core.metrics.SimulationMetrics;
import com.lorasim.core.model.NodeState;
import com.lorasim.core.routing.ConnectivityRouter;
import com.lorasim.core.routing.StateProbe;
import com.lorasim.core.scheduler.EventScheduler;
import com.lorasim.core.scheduler.StopSignal;
import com.lorasim.core.timeline.Timeline;
import com.lorasim.core.timeline.TimelineParser;
import com.lorasim.node.NodeLauncher;
import com.lorasim.node.NodeSupervisor;
import com.lorasim.node.SpawnException;
import com.lorasim.node.SupervisorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one simulation run through {@code IDLE -> SPAWNING -> RUNNING -> DRAINING -> TERMINATED}.
 *
 * <p>Flow: load timeline -> plan spawn offsets -> spawn and register each node ->
 * start the scheduler -> wait for the stop condition -> query every node once ->
 * terminate every node.
 *
 * <p>Failure semantics:
 * <ul>
 *   <li>an unreadable timeline, invalid spawn offsets or a node that fails to start
 *       abort the run; nodes already started are torn down first</li>
 *   <li>malformed connectivity updates and unknown destinations are reported by the
 *       router and scheduler; the run continues</li>
 *   <li>a node that does not answer its final query is reported absent</li>
 * </ul>
 */
@Service
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    /** Upper bound on how long draining waits for the scheduler thread to notice the stop. */
    private static final Duration SCHEDULER_STOP_GRACE = Duration.ofSeconds(1);

    private final NodeLauncher nodeLauncher;
    private final TimelineParser timelineParser;
    private final SpawnPlanner spawnPlanner;
    private final SimulationMetrics metrics;

    private volatile SimulationPhase phase = SimulationPhase.IDLE;

    public SimulationEngine(NodeLauncher nodeLauncher, TimelineParser timelineParser, SpawnPlanner spawnPlanner,
                            @Autowired(required = false) SimulationMetrics metrics) {
        this.nodeLauncher = nodeLauncher;
        this.timelineParser = timelineParser;
        this.spawnPlanner = spawnPlanner;
        this.metrics = metrics;
    }

    public SimulationPhase phase() {
        return phase;
    }

    /**
     * Loads the plan's timeline and runs it.
     *
     * @throws com.lorasim.core.timeline.TimelineException if the timeline cannot be read
     * @see #run(SimulationPlan, Timeline, StopSignal, List)
     */
    public SimulationReport run(SimulationPlan plan, StopSignal stopSignal, List<? extends LineSink> extraSinks) {
        Timeline timeline = timelineParser.load(plan.input());
        return run(plan, timeline, stopSignal, extraSinks);
    }

    /**
     * Runs one simulation to completion.
     *
     * @param plan       resolved run configuration
     * @param timeline   events to apply
     * @param stopSignal shared stop flag; may be set by any thread to end the Running phase
     * @param extraSinks sinks receiving the event log besides the log file (e.g. the console)
     * @return the final report
     * @throws SpawnException           if a node cannot be started
     * @throws IllegalArgumentException if the spawn offsets are invalid
     * @throws UncheckedIOException     if the event log file cannot be created
     */
    public synchronized SimulationReport run(SimulationPlan plan, Timeline timeline, StopSignal stopSignal,
                                             List<? extends LineSink> extraSinks) {
        phase = SimulationPhase.IDLE;
        List<SpawnPlanner.ScheduledSpawn> spawns = spawnPlanner.plan(
                plan.nodeNames(), plan.spawnOffsets(), plan.spawnMaxSeconds(), plan.seed());

        var sinks = new ArrayList<LineSink>();
        sinks.add(FileLineSink.open(plan.eventLogPath()));
        sinks.addAll(extraSinks);

        SimulationClock clock = SimulationClock.startingNow();
        boolean interrupted = false;
        Map<String, NodeSupervisor> supervisors = new LinkedHashMap<>();

        try (var eventLog = new EventLog(sinks)) {
            StateProbe probe = plan.probeStateOnForward()
                    ? new StateProbe(plan.probeTimeout(), clock, eventLog)
                    : null;
            var router = new ConnectivityRouter(plan.nodeNames(), clock, eventLog, probe, metrics);
            var context = new SupervisorContext(clock, eventLog, router, metrics);
            var scheduler = new EventScheduler(timeline, router, clock, eventLog, stopSignal, metrics);

            try {
                transition(SimulationPhase.SPAWNING);
                try {
                    spawnAll(spawns, plan, context, router, eventLog, clock, stopSignal, supervisors);
                } catch (InterruptedException e) {
                    interrupted = true;
                    stopSignal.stop(StopSignal.Reason.INTERRUPTED);
                }

                transition(SimulationPhase.RUNNING);
                if (!stopSignal.isStopped()) {
                    if (plan.stopWhenTimelineCompletes()) {
                        scheduler.onTimelineComplete(() -> stopSignal.stop(StopSignal.Reason.TIMELINE_COMPLETE));
                    }
                    scheduler.start();
                    try {
                        awaitStopCondition(plan, stopSignal);
                    } catch (InterruptedException e) {
                        interrupted = true;
                        stopSignal.stop(StopSignal.Reason.INTERRUPTED);
                    }
                }
                log.info("Stopping simulation: {}", stopSignal.reason().orElse(StopSignal.Reason.INTERRUPTED));

                transition(SimulationPhase.DRAINING);
                awaitScheduler(scheduler);
                if (probe != null) {
                    probe.shutdown(plan.probeTimeout());
                }
                List<NodeReport> reports = drain(plan, supervisors, scheduler.unknownDestinations(), clock, eventLog);

                Duration elapsed = clock.elapsed();
                if (metrics != null) {
                    metrics.recordRunDuration(elapsed);
                }
                return new SimulationReport(elapsed,
                        stopSignal.reason().orElse(StopSignal.Reason.INTERRUPTED),
                        reports,
                        scheduler.unknownDestinations(),
                        scheduler.appliedCount(),
                        plan.eventLogPath());
            } finally {
                if (probe != null) {
                    probe.shutdown(Duration.ZERO);
                }
                terminateAll(supervisors);
            }
        } finally {
            MdcContext.clear();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void spawnAll(List<SpawnPlanner.ScheduledSpawn> spawns, SimulationPlan plan, SupervisorContext context,
                          ConnectivityRouter router, EventLog eventLog, SimulationClock clock,
                          StopSignal stopSignal, Map<String, NodeSupervisor> supervisors) throws InterruptedException {
        for (var spawn : spawns) {
            Duration wait = clock.until(spawn.offsetSeconds());
            if (!wait.isNegative() && !wait.isZero() && stopSignal.awaitStop(wait)) {
                log.info("Stop requested while spawning; {} of {} nodes started", supervisors.size(), spawns.size());
                return;
            }
            if (stopSignal.isStopped()) {
                return;
            }
            NodeSupervisor supervisor = spawnNode(spawn.node(), plan, context);
            supervisors.put(spawn.node(), supervisor);
            router.register(supervisor);
            eventLog.append(SimulationEvent.initialized(clock.elapsedSeconds(), spawn.node()));
            if (metrics != null) {
                metrics.recordSpawn(spawn.node());
            }
        }
    }

    private NodeSupervisor spawnNode(String name, SimulationPlan plan, SupervisorContext context) {
        Process process = nodeLauncher.launch(name, plan.executable());
        LineSink stdoutLog = null;
        try {
            stdoutLog = FileLineSink.open(plan.stdoutLogPath(name));
            LineSink stderrLog = FileLineSink.open(plan.stderrLogPath(name));
            return NodeSupervisor.start(name, process, stdoutLog, stderrLog, context);
        } catch (UncheckedIOException e) {
            process.destroy();
            if (stdoutLog != null) {
                stdoutLog.close();
            }
            throw new SpawnException(name, "Cannot open logs for node " + name + ": " + e.getMessage(), e);
        }
    }

    private static void awaitStopCondition(SimulationPlan plan, StopSignal stopSignal) throws InterruptedException {
        Optional<Duration> duration = plan.maxDuration();
        if (duration.isPresent()) {
            if (!stopSignal.awaitStop(duration.get())) {
                stopSignal.stop(StopSignal.Reason.DURATION_ELAPSED);
            }
        } else {
            stopSignal.awaitStop();
        }
    }

    private static void awaitScheduler(EventScheduler scheduler) {
        if (!scheduler.isStarted()) {
            return;
        }
        try {
            if (!scheduler.awaitFinished(SCHEDULER_STOP_GRACE)) {
                log.warn("Scheduler still running {}ms after stop", SCHEDULER_STOP_GRACE.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One bounded state query per configured node, in configuration order. A silent
     * node is reported absent; it never stops the remaining queries.
     */
    private List<NodeReport> drain(SimulationPlan plan, Map<String, NodeSupervisor> supervisors,
                                   Set<String> unknownDestinations, SimulationClock clock, EventLog eventLog) {
        var reports = new ArrayList<NodeReport>();
        for (String name : plan.nodeNames()) {
            NodeSupervisor supervisor = supervisors.get(name);
            if (supervisor == null) {
                reports.add(NodeReport.notSpawned(name));
                continue;
            }
            if (!supervisor.isAlive()) {
                log.warn("Node {} exited before the final state query", name);
                reports.add(NodeReport.noResponse(name));
                continue;
            }
            Optional<String> response = supervisor.queryState(plan.queryTimeout());
            if (response.isEmpty()) {
                log.warn("Node {} did not answer the final state query within {}ms",
                        name, plan.queryTimeout().toMillis());
                reports.add(NodeReport.noResponse(name));
                continue;
            }
            eventLog.append(SimulationEvent.state(clock.elapsedSeconds(), name, response.get()));
            try {
                reports.add(NodeReport.answered(name, NodeState.parse(response.get())));
            } catch (IllegalArgumentException e) {
                log.warn("Node {} sent an unparseable state response: {}", name, response.get());
                reports.add(NodeReport.noResponse(name));
            }
        }
        for (String destination : unknownDestinations) {
            if (!plan.nodeNames().contains(destination)) {
                reports.add(NodeReport.unknown(destination));
            }
        }
        return reports;
    }

    private void terminateAll(Map<String, NodeSupervisor> supervisors) {
        transition(SimulationPhase.TERMINATED);
        // Stop every process before closing any logs, so late fan-out does not hit half-closed nodes.
        for (NodeSupervisor supervisor : supervisors.values()) {
            supervisor.terminate();
        }
        for (NodeSupervisor supervisor : supervisors.values()) {
            supervisor.close();
        }
        log.info("Terminated {} node processes", supervisors.size());
    }

    private void transition(SimulationPhase next) {
        log.debug("Phase {} -> {}", phase, next);
        phase = next;
        MdcContext.setPhase(next.name());
    }
}
