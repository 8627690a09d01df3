package com.lorasim.core.engine;

import com.lorasim.core.model.NodeState;

/**
 * Final-state outcome for one node.
 *
 * @param name       node name
 * @param configured whether the node was part of the configured node set
 * @param spawned    whether a process was running for it when the run stopped
 * @param state      the parsed state response, or {@code null} when the node did not answer
 */
public record NodeReport(
    String name,
    boolean configured,
    boolean spawned,
    NodeState state
) {

    public static NodeReport answered(String name, NodeState state) {
        return new NodeReport(name, true, true, state);
    }

    public static NodeReport noResponse(String name) {
        return new NodeReport(name, true, true, null);
    }

    public static NodeReport notSpawned(String name) {
        return new NodeReport(name, true, false, null);
    }

    /**
     * A timeline destination that was never configured.
     */
    public static NodeReport unknown(String name) {
        return new NodeReport(name, false, false, null);
    }

    public boolean responded() {
        return state != null;
    }
}
