package com.lorasim.node;

import com.lorasim.core.events.EventLog;
import com.lorasim.core.events.SimulationClock;
import com.lorasim.core.metrics.SimulationMetrics;

/**
 * Run-wide collaborators shared by every {@link NodeSupervisor} of one simulation.
 *
 * @param clock          elapsed time since simulation start
 * @param eventLog       destination of {@code tx} records
 * @param packetListener receives transmitted payloads for fan-out (the router)
 * @param metrics        optional metrics, may be {@code null}
 */
public record SupervisorContext(
    SimulationClock clock,
    EventLog eventLog,
    PacketListener packetListener,
    SimulationMetrics metrics
) {}
