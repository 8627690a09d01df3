package com.lorasim.node;

import java.time.Duration;
import java.util.Optional;

/**
 * What the rest of the orchestrator may do with a live node.
 * Implementation: {@link NodeSupervisor}.
 */
public interface NodeHandle {

    String name();

    /**
     * Writes one command line to the node. Fire-and-forget: delivery failures
     * are logged, never thrown.
     */
    void send(String commandLine);

    /**
     * Sends {@code get_state} and waits for the matching response line.
     * A single bounded attempt; callers wanting retries issue a new query.
     *
     * @return the raw response line, or empty when none arrived in time
     */
    Optional<String> queryState(Duration timeout);

    /**
     * Best-effort termination of the node process.
     */
    void terminate();
}
