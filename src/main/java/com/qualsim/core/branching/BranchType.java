package com.qualsim.core.branching;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BranchType {
    SUCCESS("success"),
    FAIL("fail"),
    IF("if"),
    ELIF("elif"),
    ELSE("else");

    private final String id;

    BranchType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static BranchType parse(String value) {
        for (BranchType type : values()) {
            if (type.id.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown branch type: " + value);
    }
}
