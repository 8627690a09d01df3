package com.lorasim.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed {@code get_state} response:
 * {@code get_state,<uptime_ms>,<name1>,<ts1>,<lat1>,<lon1>,...}.
 *
 * @param uptimeMs node-reported uptime, verbatim
 * @param entries  one entry per complete 4-tuple; a trailing partial tuple is ignored
 * @param raw      the response line as received
 */
public record NodeState(
    String uptimeMs,
    List<NodeEntry> entries,
    String raw
) {

    public static final String RESPONSE_TAG = "get_state";

    public NodeState {
        entries = List.copyOf(entries);
    }

    /**
     * @throws IllegalArgumentException if the line is not a state response
     */
    public static NodeState parse(String line) {
        String[] parts = line.split(",", -1);
        if (!RESPONSE_TAG.equals(parts[0]) || parts.length < 2) {
            throw new IllegalArgumentException("Not a get_state response: " + line);
        }
        var entries = new ArrayList<NodeEntry>();
        for (int i = 2; i + 3 < parts.length; i += 4) {
            entries.add(new NodeEntry(parts[i], parts[i + 1], parts[i + 2], parts[i + 3]));
        }
        return new NodeState(parts[1], entries, line);
    }

    public static boolean isStateResponse(String line) {
        return line.startsWith(RESPONSE_TAG);
    }
}
