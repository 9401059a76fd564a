package com.qualsim.core.branching;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CompoundType {
    AND("and"),
    OR("or");

    private final String id;

    CompoundType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
