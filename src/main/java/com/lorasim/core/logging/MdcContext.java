package com.lorasim.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Lorasim-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setNode(String nodeName) {
        MDC.put("node", nodeName);
    }

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("node");
        MDC.remove("phase");
    }
}
