package com.qualsim.core.error;

/**
 * Thrown when action parameters or knowledge-base references fail validation.
 */
public class ValidationException extends SimulationException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
