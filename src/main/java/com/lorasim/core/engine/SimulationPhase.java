package com.lorasim.core.engine;

/**
 * Lifecycle of one simulation run. Transitions only move forward.
 */
public enum SimulationPhase {
    IDLE,
    SPAWNING,
    RUNNING,
    DRAINING,
    TERMINATED
}
