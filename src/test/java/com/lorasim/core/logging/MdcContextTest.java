package com.lorasim.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setsNodeAndPhase() {
        MdcContext.setNode("ND01");
        MdcContext.setPhase("RUNNING");

        assertEquals("ND01", MDC.get("node"));
        assertEquals("RUNNING", MDC.get("phase"));
    }

    @Test
    void clearRemovesOnlyLorasimKeys() {
        MDC.put("other", "kept");
        MdcContext.setNode("ND01");
        MdcContext.setPhase("DRAINING");

        MdcContext.clear();

        assertNull(MDC.get("node"));
        assertNull(MDC.get("phase"));
        assertEquals("kept", MDC.get("other"));
    }
}
