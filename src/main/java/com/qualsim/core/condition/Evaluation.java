package com.qualsim.core.condition;

import com.qualsim.core.model.AttributePath;

import java.util.Set;

/**
 * Three-valued outcome of evaluating a condition.
 *
 * @param truth     the outcome
 * @param witnesses attributes whose ambiguity made the result {@link Truth#UNKNOWN}; empty otherwise
 */
public record Evaluation(Truth truth, Set<AttributePath> witnesses) {

    public static final Evaluation TRUE = new Evaluation(Truth.TRUE, Set.of());
    public static final Evaluation FALSE = new Evaluation(Truth.FALSE, Set.of());

    public Evaluation {
        witnesses = Set.copyOf(witnesses);
    }

    public static Evaluation of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Evaluation unknown(Set<AttributePath> witnesses) {
        return new Evaluation(Truth.UNKNOWN, witnesses);
    }

    public boolean isTrue() {
        return truth == Truth.TRUE;
    }

    public boolean isFalse() {
        return truth == Truth.FALSE;
    }

    public boolean isUnknown() {
        return truth == Truth.UNKNOWN;
    }

    public Evaluation negate() {
        return switch (truth) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> this;
        };
    }

    public enum Truth {
        TRUE,
        FALSE,
        UNKNOWN
    }
}
