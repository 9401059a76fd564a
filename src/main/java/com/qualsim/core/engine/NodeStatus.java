package com.qualsim.core.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one action application on one branch.
 */
public enum NodeStatus {
    OK("ok"),                                   // effects applied, constraints hold or are undecided
    REJECTED("rejected"),                       // precondition failed, no effects applied
    CONSTRAINT_VIOLATED("constraint_violated"), // effects applied, a dependency rule failed
    ERROR("error");                             // terminal failure, never expanded further

    private final String id;

    NodeStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Whether nodes with this status are expanded by the next action. */
    public boolean isExpandable() {
        return this != ERROR;
    }

    @JsonCreator
    public static NodeStatus parse(String value) {
        for (NodeStatus status : values()) {
            if (status.id.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown node status: " + value);
    }
}
