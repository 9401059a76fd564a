package com.qualsim.core.branching;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BranchSource {
    PRECONDITION("precondition"),
    POSTCONDITION("postcondition");

    private final String id;

    BranchSource(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static BranchSource parse(String value) {
        for (BranchSource source : values()) {
            if (source.id.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown branch source: " + value);
    }
}
