package com.qualsim.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setSimulation puts simulationId in MDC")
    void setSimulation() {
        MdcContext.setSimulation("sim-0001");
        assertEquals("sim-0001", MDC.get("simulationId"));
    }

    @Test
    @DisplayName("setLayer puts simulationId, action and layer in MDC")
    void setLayer() {
        MdcContext.setLayer("sim-0001", "turn_on", 2);
        assertEquals("sim-0001", MDC.get("simulationId"));
        assertEquals("turn_on", MDC.get("action"));
        assertEquals("2", MDC.get("layer"));
    }

    @Test
    @DisplayName("clear removes all simulation MDC keys")
    void clear() {
        MdcContext.setLayer("sim-0001", "drain", 3);
        MdcContext.clear();
        assertNull(MDC.get("simulationId"));
        assertNull(MDC.get("action"));
        assertNull(MDC.get("layer"));
    }
}
