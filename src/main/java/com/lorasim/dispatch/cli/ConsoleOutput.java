package com.lorasim.dispatch.cli;

import com.lorasim.core.engine.NodeReport;
import com.lorasim.core.engine.SimulationReport;
import com.lorasim.core.health.PreflightResult;
import com.lorasim.core.model.NodeEntry;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for Lorasim CLI.
 */
public class ConsoleOutput {

    static final String SEPARATOR = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LORASIM v0.1.0|@"));
        System.out.println(SEPARATOR);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LORASIM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void check(PreflightResult result) {
        String label = result.check() + ": " + result.detail();
        switch (result.status()) {
            case UP -> success(label);
            case DOWN -> error(label);
            case DEGRADED -> info(label);
        }
        for (String finding : result.findings()) {
            System.out.println("    - " + finding);
        }
    }

    /**
     * Prints the per-node final states followed by the termination line.
     */
    public static void finalStates(SimulationReport report) {
        for (String line : finalStateLines(report)) {
            System.out.println(line);
        }
    }

    static List<String> finalStateLines(SimulationReport report) {
        var lines = new ArrayList<String>();
        lines.add("");
        lines.add("Final node states:");
        for (NodeReport node : report.nodes()) {
            lines.add("");
            lines.add(node.name() + ":");
            if (!node.responded()) {
                lines.add(node.configured() ? "  <no response>" : "  <no response> (not configured)");
                continue;
            }
            lines.add(String.format("    %4s %10s %10s %10s", "Node", "Timestamp", "Lat", "Lon"));
            for (NodeEntry entry : node.state().entries()) {
                lines.add(String.format("    %4s %10s %10s %10s",
                        entry.name(), entry.timestamp(), entry.latitude(), entry.longitude()));
            }
        }
        lines.add(SEPARATOR);
        lines.add(String.format("Stopped: %s after %.1fs, %d timeline events applied",
                report.stopReason(), report.elapsed().toMillis() / 1000.0, report.eventsApplied()));
        lines.add("Simulation terminated.");
        return lines;
    }
}
