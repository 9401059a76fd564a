package com.qualsim.core.space;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators over ordered qualitative levels.
 */
public enum Operator {
    EQUALS("equals", "=="),
    NOT_EQUALS("not_equals", "!="),
    LESS_THAN("lt", "<"),
    LESS_THAN_OR_EQUAL("lte", "<="),
    GREATER_THAN("gt", ">"),
    GREATER_THAN_OR_EQUAL("gte", ">="),
    IN("in", "in"),
    NOT_IN("not_in", "not in");

    private final String id;
    private final String symbol;

    Operator(String id, String symbol) {
        this.id = id;
        this.symbol = symbol;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String symbol() {
        return symbol;
    }

    /** Whether the operator compares against a set of levels rather than a single pivot. */
    public boolean isSetOperator() {
        return this == IN || this == NOT_IN;
    }

    /**
     * The operator whose satisfying set is the complement of this one.
     */
    public Operator negate() {
        return switch (this) {
            case EQUALS -> NOT_EQUALS;
            case NOT_EQUALS -> EQUALS;
            case LESS_THAN -> GREATER_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN;
            case GREATER_THAN -> LESS_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN;
            case IN -> NOT_IN;
            case NOT_IN -> IN;
        };
    }

    /**
     * Accepts the identifier ({@code lt}), the long name ({@code less_than}) or the symbol ({@code <}).
     */
    @JsonCreator
    public static Operator parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operator must not be null");
        }
        String normalized = value.trim();
        for (Operator op : values()) {
            if (op.id.equalsIgnoreCase(normalized) || op.symbol.equals(normalized)
                    || op.name().equalsIgnoreCase(normalized)) {
                return op;
            }
        }
        if ("=".equals(normalized)) {
            return EQUALS;
        }
        throw new IllegalArgumentException("Unknown operator: " + value);
    }
}
