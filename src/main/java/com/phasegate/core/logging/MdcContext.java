package com.phasegate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing PhaseGate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPhase(int phase, String agent) {
        MDC.put("phase", String.valueOf(phase));
        MDC.put("agent", agent);
    }

    public static void clear() {
        MDC.remove("phase");
        MDC.remove("agent");
    }
}
