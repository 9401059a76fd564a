package com.qualsim.core.model;

/**
 * Declaration of one attribute inside an object type.
 *
 * @param space        name of the qualitative space the attribute ranges over
 * @param defaultValue initial level, or {@link #UNKNOWN} for the whole space
 * @param mutable      whether effects may write it
 */
public record AttributeSpec(String space, String defaultValue, boolean mutable) {

    public static final String UNKNOWN = "unknown";

    public AttributeSpec {
        if (space == null || space.isBlank()) {
            throw new IllegalArgumentException("Attribute spec needs a space");
        }
        defaultValue = defaultValue == null ? UNKNOWN : defaultValue;
    }

    public boolean defaultsToUnknown() {
        return UNKNOWN.equals(defaultValue);
    }
}
