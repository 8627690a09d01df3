package com.lorasim.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for simulation runs.
 */
@Service
public class SimulationMetrics {

    private final MeterRegistry registry;

    public SimulationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn(String node) {
        Counter.builder("lorasim.nodes.spawned")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    public void recordTransmit(String node) {
        Counter.builder("lorasim.packets.transmitted")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    public void recordForward(String src, String dst) {
        Counter.builder("lorasim.packets.forwarded")
                .tag("src", src)
                .tag("dst", dst)
                .register(registry)
                .increment();
    }

    public void recordConnectivityUpdate(boolean accepted) {
        Counter.builder("lorasim.connectivity.updates")
                .tag("result", accepted ? "applied" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordUnknownDestination() {
        Counter.builder("lorasim.timeline.unknown_destinations")
                .description("Timeline events addressed to a node that is not running")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome {@code answered} or {@code timeout}
     */
    public void recordStateQuery(String outcome) {
        Counter.builder("lorasim.state.queries")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRunDuration(Duration elapsed) {
        Timer.builder("lorasim.run.duration")
                .register(registry)
                .record(elapsed);
    }

    public double count(String name) {
        return registry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
