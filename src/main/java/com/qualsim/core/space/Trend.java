package com.qualsim.core.space;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of change attached to an attribute value.
 */
public enum Trend {
    UP("up"),
    DOWN("down"),
    NONE("none");

    private final String id;

    Trend(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static Trend parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        for (Trend trend : values()) {
            if (trend.id.equalsIgnoreCase(value.trim())) {
                return trend;
            }
        }
        throw new IllegalArgumentException("Unknown trend: " + value);
    }
}
