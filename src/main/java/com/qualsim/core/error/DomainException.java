package com.qualsim.core.error;

/**
 * Thrown when a value falls outside the qualitative space of its attribute.
 */
public class DomainException extends SimulationException {

    public DomainException(String message) {
        super(message);
    }
}
