package com.qualsim.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys attached to log lines while a simulation runs.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSimulation(String simulationId) {
        MDC.put("simulationId", simulationId);
    }

    public static void setLayer(String simulationId, String action, int layer) {
        MDC.put("simulationId", simulationId);
        MDC.put("action", action);
        MDC.put("layer", String.valueOf(layer));
    }

    public static void clear() {
        MDC.remove("simulationId");
        MDC.remove("action");
        MDC.remove("layer");
    }
}
