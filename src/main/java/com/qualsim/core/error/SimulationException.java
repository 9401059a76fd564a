package com.qualsim.core.error;

/**
 * Base type for every failure raised while loading a knowledge base or applying actions.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
