package com.qualsim.core.effect;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeKind {
    VALUE("value"),
    TREND("trend"),
    // level set reduced by a branch decision, not written by an effect
    NARROWING("narrowing"),
    CONSTRAINT("constraint");

    private final String id;

    ChangeKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ChangeKind parse(String value) {
        for (ChangeKind kind : values()) {
            if (kind.id.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown change kind: " + value);
    }
}
