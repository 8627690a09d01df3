package com.lorasim.core.engine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Everything one simulation run needs, resolved from properties and CLI overrides.
 *
 * @param nodeNames                 configured nodes, in configuration (and matrix) order
 * @param executable                node program started once per node
 * @param input                     timeline file
 * @param outdir                    directory for the event log and per-node logs
 * @param duration                  run length after spawning, or {@code null} to wait for cancellation
 * @param spawnOffsets              explicit per-node offsets in seconds; empty for seeded random offsets
 * @param spawnMaxSeconds           upper bound of random offsets
 * @param seed                      random offset seed
 * @param queryTimeout              deadline of each final state query
 * @param probeStateOnForward       query a node's state after each forwarded packet
 * @param probeTimeout              deadline of those probes
 * @param stopWhenTimelineCompletes stop once every timeline event has been applied
 */
public record SimulationPlan(
    List<String> nodeNames,
    Path executable,
    Path input,
    Path outdir,
    Duration duration,
    List<Double> spawnOffsets,
    double spawnMaxSeconds,
    long seed,
    Duration queryTimeout,
    boolean probeStateOnForward,
    Duration probeTimeout,
    boolean stopWhenTimelineCompletes
) {

    public static final String EVENT_LOG_FILE = "sim_output.log";
    public static final String REPORT_FILE = "final_states.json";

    public SimulationPlan {
        if (nodeNames == null || nodeNames.isEmpty()) {
            throw new IllegalArgumentException("At least one node name is required");
        }
        if (new HashSet<>(nodeNames).size() != nodeNames.size()) {
            throw new IllegalArgumentException("Node names must be unique: " + nodeNames);
        }
        if (nodeNames.contains("-1")) {
            throw new IllegalArgumentException("'-1' is reserved for connectivity updates and cannot name a node");
        }
        nodeNames = List.copyOf(nodeNames);
        spawnOffsets = spawnOffsets == null ? List.of() : List.copyOf(spawnOffsets);
    }

    public Optional<Duration> maxDuration() {
        return Optional.ofNullable(duration);
    }

    public Path eventLogPath() {
        return outdir.resolve(EVENT_LOG_FILE);
    }

    public Path stdoutLogPath(String node) {
        return outdir.resolve(node + ".stdout.log");
    }

    public Path stderrLogPath(String node) {
        return outdir.resolve(node + ".stderr.log");
    }

    public static Builder builder(SimulationProperties properties) {
        return new Builder(properties);
    }

    /**
     * Starts from configured defaults; every setter overrides one value.
     */
    public static class Builder {
        private List<String> nodeNames;
        private Path executable;
        private Path input;
        private Path outdir;
        private Duration duration;
        private List<Double> spawnOffsets;
        private double spawnMaxSeconds;
        private long seed;
        private Duration queryTimeout;
        private boolean probeStateOnForward;
        private Duration probeTimeout;
        private boolean stopWhenTimelineCompletes;

        Builder(SimulationProperties properties) {
            this.nodeNames = new ArrayList<>(properties.getNodeNames());
            this.executable = Path.of(properties.getExecutable());
            this.outdir = Path.of(properties.getOutdir());
            this.duration = toDuration(properties.getDurationSeconds());
            this.spawnOffsets = new ArrayList<>(properties.getSpawnOffsets());
            this.spawnMaxSeconds = properties.getSpawnMaxSeconds();
            this.seed = properties.getSeed();
            this.queryTimeout = Duration.ofMillis(properties.getQueryTimeoutMs());
            this.probeStateOnForward = properties.isProbeStateOnForward();
            this.probeTimeout = Duration.ofMillis(properties.getProbeTimeoutMs());
            this.stopWhenTimelineCompletes = properties.isStopWhenTimelineCompletes();
        }

        public Builder nodeNames(List<String> nodeNames) { this.nodeNames = nodeNames; return this; }
        public Builder executable(Path executable) { this.executable = executable; return this; }
        public Builder input(Path input) { this.input = input; return this; }
        public Builder outdir(Path outdir) { this.outdir = outdir; return this; }
        public Builder durationSeconds(Double seconds) { this.duration = toDuration(seconds); return this; }
        public Builder spawnOffsets(List<Double> spawnOffsets) { this.spawnOffsets = spawnOffsets; return this; }
        public Builder spawnMaxSeconds(double spawnMaxSeconds) { this.spawnMaxSeconds = spawnMaxSeconds; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder queryTimeout(Duration queryTimeout) { this.queryTimeout = queryTimeout; return this; }
        public Builder probeStateOnForward(boolean probe) { this.probeStateOnForward = probe; return this; }
        public Builder probeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; return this; }
        public Builder stopWhenTimelineCompletes(boolean stop) { this.stopWhenTimelineCompletes = stop; return this; }

        public SimulationPlan build() {
            if (input == null) {
                throw new IllegalArgumentException("A timeline input file is required");
            }
            return new SimulationPlan(nodeNames, executable, input, outdir, duration, spawnOffsets,
                    spawnMaxSeconds, seed, queryTimeout, probeStateOnForward, probeTimeout,
                    stopWhenTimelineCompletes);
        }

        private static Duration toDuration(Double seconds) {
            if (seconds == null) {
                return null;
            }
            if (!Double.isFinite(seconds) || seconds < 0) {
                throw new IllegalArgumentException("duration must be a finite number >= 0, got " + seconds);
            }
            return Duration.ofNanos((long) (seconds * 1_000_000_000L));
        }
    }
}
