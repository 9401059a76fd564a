package com.qualsim.core.error;

/**
 * Thrown when an effect tries to write an attribute declared immutable.
 */
public class ImmutableWriteException extends SimulationException {

    private final String attribute;

    public ImmutableWriteException(String attribute) {
        super("Attribute '" + attribute + "' is immutable and cannot be written");
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
