package com.lorasim.core.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationPropertiesTest {

    @Test
    void nodeDefaults() {
        var props = new SimulationProperties();
        assertEquals(List.of("ND01", "ND02", "ND03", "ND04"), props.getNodeNames());
        assertEquals("./network_simulator", props.getExecutable());
        assertEquals(5.0, props.getSpawnMaxSeconds());
        assertEquals(0, props.getSeed());
        assertTrue(props.getSpawnOffsets().isEmpty());
    }

    @Test
    void runDefaults() {
        var props = new SimulationProperties();
        assertEquals(".", props.getOutdir());
        assertNull(props.getDurationSeconds());
        assertEquals(1000, props.getQueryTimeoutMs());
        assertFalse(props.isStopWhenTimelineCompletes());
        assertTrue(props.isEchoEvents());
    }

    @Test
    void routerDefaults() {
        var props = new SimulationProperties();
        assertTrue(props.isProbeStateOnForward());
        assertEquals(200, props.getProbeTimeoutMs());
    }
}
