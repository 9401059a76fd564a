package com.qualsim.core.condition;

/**
 * Boolean expression over attributes and action parameters.
 */
public sealed interface Condition permits AttributeCheck, ParameterCheck, And, Or, Not, Implication {

    /** Human-readable rendering used in logs, branch labels and error messages. */
    String describe();
}
