package com.lorasim.core.engine;

import com.lorasim.core.scheduler.StopSignal;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of a completed simulation run.
 *
 * @param elapsed             wall-clock time from simulation start to the end of draining
 * @param stopReason          what ended the Running phase
 * @param nodes               final state per configured node (configuration order), then unknown destinations
 * @param unknownDestinations timeline destinations that had no running node
 * @param eventsApplied       timeline events applied before the stop
 * @param eventLog            path of the event log file
 */
public record SimulationReport(
    Duration elapsed,
    StopSignal.Reason stopReason,
    List<NodeReport> nodes,
    Set<String> unknownDestinations,
    int eventsApplied,
    Path eventLog
) {

    public SimulationReport {
        nodes = List.copyOf(nodes);
        unknownDestinations = Set.copyOf(unknownDestinations);
    }

    public Optional<NodeReport> node(String name) {
        return nodes.stream().filter(n -> n.name().equals(name)).findFirst();
    }

    public long respondedCount() {
        return nodes.stream().filter(NodeReport::responded).count();
    }
}
