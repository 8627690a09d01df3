package com.lorasim.core.engine;

import com.lorasim.core.events.RecordingSink;
import com.lorasim.core.metrics.SimulationMetrics;
import com.lorasim.core.scheduler.StopSignal;
import com.lorasim.core.timeline.Timeline;
import com.lorasim.core.timeline.TimelineParser;
import com.lorasim.node.NodeLauncher;
import com.lorasim.node.NodeProtocol;
import com.lorasim.node.ScriptedNodeProcess;
import com.lorasim.node.SpawnException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link SimulationEngine} with in-memory node processes.
 */
class SimulationEngineTest {

    @TempDir
    Path outdir;

    private final Map<String, ScriptedNodeProcess> processes = new ConcurrentHashMap<>();
    private SimulationMetrics metrics;
    private TimelineParser parser;
    private SimulationEngine engine;

    /** Node A transmits DEAD when told to; both nodes answer get_state. */
    private static ScriptedNodeProcess scripted(String name) {
        return new ScriptedNodeProcess(name, line -> {
            if ("send DEAD".equals(line)) {
                return List.of("transmit_packet,2,DEAD");
            }
            if (NodeProtocol.GET_STATE.equals(line)) {
                return List.of("get_state,100," + name + ",5,48.1,11.5");
            }
            return List.of();
        });
    }

    private final NodeLauncher launcher = (name, executable) -> {
        var process = scripted(name);
        processes.put(name, process);
        return process;
    };

    @BeforeEach
    void setUp() {
        metrics = new SimulationMetrics(new SimpleMeterRegistry());
        parser = new TimelineParser();
        engine = new SimulationEngine(launcher, parser, new SpawnPlanner(), metrics);
    }

    private SimulationPlan.Builder plan() {
        return SimulationPlan.builder(new SimulationProperties())
                .nodeNames(List.of("A", "B"))
                .input(outdir.resolve("events.csv"))
                .outdir(outdir)
                .spawnOffsets(List.of(0.0, 0.0))
                .queryTimeout(Duration.ofMillis(500))
                .probeStateOnForward(false)
                .stopWhenTimelineCompletes(true);
    }

    private static int indexOf(List<String> lines, String suffix) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).endsWith(suffix)) {
                return i;
            }
        }
        return -1;
    }

    @Nested
    @DisplayName("Full run")
    class FullRun {

        @Test
        @DisplayName("routes a transmission over the configured link and reports final states")
        void routesTransmission() throws Exception {
            Files.writeString(outdir.resolve("events.csv"), """
                    0,-1,0110
                    0.05,A,send DEAD
                    0.1,C,hello
                    """);
            var console = new RecordingSink();

            SimulationReport report = engine.run(plan().build(), new StopSignal(), List.of(console));

            assertEquals(StopSignal.Reason.TIMELINE_COMPLETE, report.stopReason());
            assertEquals(SimulationPhase.TERMINATED, engine.phase());
            assertEquals(3, report.eventsApplied());

            List<String> lines = Files.readAllLines(outdir.resolve("sim_output.log"));
            assertEquals(lines, console.lines());
            assertTrue(indexOf(lines, ",initialized,A") >= 0);
            assertTrue(indexOf(lines, ",initialized,B") >= 0);
            assertTrue(lines.contains("0.000,connectivity_update,0110"));
            assertTrue(lines.contains("0.050,send_command,A,send DEAD"));
            int tx = indexOf(lines, ",tx,A,DEAD");
            int forward = indexOf(lines, ",forward,A,B,DEAD");
            assertTrue(tx >= 0 && forward > tx, lines.toString());
            assertTrue(indexOf(lines, ",state,A,get_state,100,A,5,48.1,11.5") > forward);
            assertEquals(-1, indexOf(lines, ",forward,B,A,DEAD"));

            assertTrue(processes.get("B").received().contains("network_receive_packet,DEAD"));
            assertFalse(processes.get("A").received().contains("network_receive_packet,DEAD"));

            NodeReport a = report.node("A").orElseThrow();
            assertTrue(a.responded());
            assertEquals("100", a.state().uptimeMs());
            assertEquals(1, a.state().entries().size());
            assertTrue(report.node("B").orElseThrow().responded());

            NodeReport c = report.node("C").orElseThrow();
            assertFalse(c.configured());
            assertFalse(c.responded());
            assertEquals(Set.of("C"), report.unknownDestinations());
            assertEquals(2, report.respondedCount());
        }

        @Test
        @DisplayName("writes per-node stdout logs and terminates every node")
        void writesNodeLogsAndTerminates() throws Exception {
            Timeline timeline = parser.parse("0,-1,0110\n0.01,A,send DEAD\n");

            engine.run(plan().build(), timeline, new StopSignal(), List.of());

            assertFalse(processes.get("A").isAlive());
            assertFalse(processes.get("B").isAlive());
            List<String> stdoutA = Files.readAllLines(outdir.resolve("A.stdout.log"));
            assertTrue(stdoutA.stream().anyMatch(l -> l.endsWith(",transmit_packet,2,DEAD")));
            assertTrue(Files.exists(outdir.resolve("B.stderr.log")));
            assertEquals(2.0, metrics.count("lorasim.nodes.spawned"));
            assertEquals(1.0, metrics.count("lorasim.packets.forwarded"));
        }

        @Test
        @DisplayName("a disconnected pair exchanges nothing")
        void disconnectedNodesDoNotForward() throws Exception {
            Timeline timeline = parser.parse("0.01,A,send DEAD\n");

            engine.run(plan().build(), timeline, new StopSignal(), List.of());

            List<String> lines = Files.readAllLines(outdir.resolve("sim_output.log"));
            assertTrue(indexOf(lines, ",tx,A,DEAD") >= 0);
            assertEquals(-1, indexOf(lines, ",forward,A,B,DEAD"));
            assertFalse(processes.get("B").received().contains("network_receive_packet,DEAD"));
        }
    }

    @Nested
    @DisplayName("Stopping")
    class Stopping {

        @Test
        @DisplayName("duration ends the run and silent nodes are reported without a response")
        void durationElapsed() {
            engine = new SimulationEngine((name, exe) -> ScriptedNodeProcess.silent(name),
                    parser, new SpawnPlanner(), null);
            var plan = plan()
                    .durationSeconds(0.2)
                    .stopWhenTimelineCompletes(false)
                    .queryTimeout(Duration.ofMillis(100))
                    .build();

            long start = System.nanoTime();
            SimulationReport report = engine.run(plan, Timeline.empty(), new StopSignal(), List.of());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertEquals(StopSignal.Reason.DURATION_ELAPSED, report.stopReason());
            assertTrue(elapsedMs >= 200, "stopped after " + elapsedMs + "ms");
            assertTrue(elapsedMs < 5000, "stopped after " + elapsedMs + "ms");
            assertEquals(0, report.respondedCount());
            assertTrue(report.node("A").orElseThrow().spawned());
        }

        @Test
        @DisplayName("a stop before spawning leaves every node unspawned")
        void stoppedBeforeSpawning() {
            var stopSignal = new StopSignal();
            stopSignal.stop(StopSignal.Reason.OPERATOR_CANCEL);

            SimulationReport report = engine.run(plan().build(), Timeline.empty(), stopSignal, List.of());

            assertEquals(StopSignal.Reason.OPERATOR_CANCEL, report.stopReason());
            assertTrue(processes.isEmpty());
            assertFalse(report.node("A").orElseThrow().spawned());
            assertFalse(report.node("B").orElseThrow().spawned());
        }

        @Test
        @DisplayName("an external stop ends an open-ended run")
        void externalStop() throws Exception {
            var stopSignal = new StopSignal();
            var plan = plan().stopWhenTimelineCompletes(false).build();
            var stopper = new Thread(() -> {
                try {
                    Thread.sleep(150);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                stopSignal.stop(StopSignal.Reason.OPERATOR_CANCEL);
            });
            stopper.start();

            SimulationReport report = engine.run(plan, Timeline.empty(), stopSignal, List.of());
            stopper.join();

            assertEquals(StopSignal.Reason.OPERATOR_CANCEL, report.stopReason());
            assertEquals(2, report.respondedCount());
        }

        @Test
        @DisplayName("a node that already exited is not queried while draining")
        void exitedNodeIsNotQueried() throws Exception {
            var stopSignal = new StopSignal();
            var plan = plan()
                    .stopWhenTimelineCompletes(false)
                    .queryTimeout(Duration.ofSeconds(3))
                    .build();
            var killer = new Thread(() -> {
                try {
                    while (!processes.containsKey("B")) {
                        Thread.sleep(10);
                    }
                    processes.get("B").destroy();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                stopSignal.stop(StopSignal.Reason.OPERATOR_CANCEL);
            });
            killer.start();

            long start = System.nanoTime();
            SimulationReport report = engine.run(plan, Timeline.empty(), stopSignal, List.of());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            killer.join();

            assertTrue(report.node("A").orElseThrow().responded());
            NodeReport b = report.node("B").orElseThrow();
            assertTrue(b.spawned());
            assertFalse(b.responded());
            assertFalse(processes.get("B").received().contains(NodeProtocol.GET_STATE));
            assertTrue(elapsedMs < 3000, "drained after " + elapsedMs + "ms");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a node that fails to start aborts the run and tears down started nodes")
        void spawnFailure() {
            engine = new SimulationEngine((name, exe) -> {
                if ("B".equals(name)) {
                    throw new SpawnException(name, "Failed to start node B", null);
                }
                return launcher.launch(name, exe);
            }, parser, new SpawnPlanner(), metrics);

            var e = assertThrows(SpawnException.class,
                    () -> engine.run(plan().build(), Timeline.empty(), new StopSignal(), List.of()));

            assertEquals("B", e.getNodeName());
            assertFalse(processes.get("A").isAlive());
            assertEquals(SimulationPhase.TERMINATED, engine.phase());
        }

        @Test
        @DisplayName("mismatched spawn offsets fail before any node starts")
        void mismatchedOffsets() {
            var plan = plan().spawnOffsets(List.of(0.0)).build();

            assertThrows(IllegalArgumentException.class,
                    () -> engine.run(plan, Timeline.empty(), new StopSignal(), List.of()));
            assertTrue(processes.isEmpty());
        }

        @Test
        @DisplayName("an unreadable timeline fails before any node starts")
        void missingTimeline() {
            assertThrows(com.lorasim.core.timeline.TimelineException.class,
                    () -> engine.run(plan().build(), new StopSignal(), List.of()));
            assertTrue(processes.isEmpty());
        }
    }
}
