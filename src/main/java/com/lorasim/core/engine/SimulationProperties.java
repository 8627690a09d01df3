package com.lorasim.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "lorasim")
public class SimulationProperties {

    private Nodes nodes = new Nodes();
    private Run run = new Run();
    private Router router = new Router();

    // -- Nodes accessors (delegate to nested) --
    public List<String> getNodeNames() { return nodes.names; }
    public String getExecutable() { return nodes.executable; }
    public double getSpawnMaxSeconds() { return nodes.spawnMaxSeconds; }
    public long getSeed() { return nodes.seed; }
    public List<Double> getSpawnOffsets() { return nodes.spawnOffsets; }

    // -- Run accessors (delegate to nested) --
    public String getOutdir() { return run.outdir; }
    public Double getDurationSeconds() { return run.durationSeconds; }
    public long getQueryTimeoutMs() { return run.queryTimeoutMs; }
    public boolean isStopWhenTimelineCompletes() { return run.stopWhenTimelineCompletes; }
    public boolean isEchoEvents() { return run.echoEvents; }

    // -- Router accessors (delegate to nested) --
    public boolean isProbeStateOnForward() { return router.probeStateOnForward; }
    public long getProbeTimeoutMs() { return router.probeTimeoutMs; }

    public Nodes getNodes() { return nodes; }
    public void setNodes(Nodes nodes) { this.nodes = nodes; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Router getRouter() { return router; }
    public void setRouter(Router router) { this.router = router; }

    public static class Nodes {
        private List<String> names = new ArrayList<>(List.of("ND01", "ND02", "ND03", "ND04"));
        private String executable = "./network_simulator";
        private double spawnMaxSeconds = 5.0;
        private long seed = 0;
        private List<Double> spawnOffsets = new ArrayList<>();

        public List<String> getNames() { return names; }
        public void setNames(List<String> names) { this.names = names; }
        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public double getSpawnMaxSeconds() { return spawnMaxSeconds; }
        public void setSpawnMaxSeconds(double spawnMaxSeconds) { this.spawnMaxSeconds = spawnMaxSeconds; }
        public long getSeed() { return seed; }
        public void setSeed(long seed) { this.seed = seed; }
        public List<Double> getSpawnOffsets() { return spawnOffsets; }
        public void setSpawnOffsets(List<Double> spawnOffsets) { this.spawnOffsets = spawnOffsets; }
    }

    public static class Run {
        private String outdir = ".";
        private Double durationSeconds;
        private long queryTimeoutMs = 1000;
        private boolean stopWhenTimelineCompletes = false;
        private boolean echoEvents = true;

        public String getOutdir() { return outdir; }
        public void setOutdir(String outdir) { this.outdir = outdir; }
        public Double getDurationSeconds() { return durationSeconds; }
        public void setDurationSeconds(Double durationSeconds) { this.durationSeconds = durationSeconds; }
        public long getQueryTimeoutMs() { return queryTimeoutMs; }
        public void setQueryTimeoutMs(long queryTimeoutMs) { this.queryTimeoutMs = queryTimeoutMs; }
        public boolean isStopWhenTimelineCompletes() { return stopWhenTimelineCompletes; }
        public void setStopWhenTimelineCompletes(boolean stopWhenTimelineCompletes) { this.stopWhenTimelineCompletes = stopWhenTimelineCompletes; }
        public boolean isEchoEvents() { return echoEvents; }
        public void setEchoEvents(boolean echoEvents) { this.echoEvents = echoEvents; }
    }

    public static class Router {
        private boolean probeStateOnForward = true;
        private long probeTimeoutMs = 200;

        public boolean isProbeStateOnForward() { return probeStateOnForward; }
        public void setProbeStateOnForward(boolean probeStateOnForward) { this.probeStateOnForward = probeStateOnForward; }
        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
    }
}
