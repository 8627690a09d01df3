package com.lorasim.core.events;

import java.util.List;
import java.util.Locale;

/**
 * One immutable record of the simulation event log.
 *
 * @param elapsedSeconds seconds since simulation start (logical timestamp for scheduled records)
 * @param kind           record kind
 * @param fields         kind-specific fields, in wire order
 */
public record SimulationEvent(
    double elapsedSeconds,
    EventKind kind,
    List<String> fields
) {

    public SimulationEvent {
        fields = List.copyOf(fields);
    }

    public static SimulationEvent initialized(double ts, String node) {
        return new SimulationEvent(ts, EventKind.INITIALIZED, List.of(node));
    }

    public static SimulationEvent connectivityUpdate(double ts, String bitstring) {
        return new SimulationEvent(ts, EventKind.CONNECTIVITY_UPDATE, List.of(bitstring));
    }

    public static SimulationEvent tx(double ts, String src, String hexData) {
        return new SimulationEvent(ts, EventKind.TX, List.of(src, hexData));
    }

    public static SimulationEvent forward(double ts, String src, String dst, String hexData) {
        return new SimulationEvent(ts, EventKind.FORWARD, List.of(src, dst, hexData));
    }

    public static SimulationEvent sendCommand(double ts, String dst, String command) {
        return new SimulationEvent(ts, EventKind.SEND_COMMAND, List.of(dst, command));
    }

    public static SimulationEvent state(double ts, String node, String rawResponse) {
        return new SimulationEvent(ts, EventKind.STATE, List.of(node, rawResponse));
    }

    /**
     * Renders the record as a log line, without the trailing newline.
     * Timestamps carry millisecond precision.
     */
    public String toLogLine() {
        var sb = new StringBuilder(formatSeconds(elapsedSeconds))
                .append(',')
                .append(kind.wireName());
        for (String field : fields) {
            sb.append(',').append(field);
        }
        return sb.toString();
    }

    public static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
