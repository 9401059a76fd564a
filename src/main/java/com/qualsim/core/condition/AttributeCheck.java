package com.qualsim.core.condition;

import com.qualsim.core.model.AttributePath;
import com.qualsim.core.space.Operator;

/**
 * Compares an attribute against a level, a set of levels or a parameter.
 */
public record AttributeCheck(AttributePath target, Operator operator, ValueRef value) implements Condition {

    @Override
    public String describe() {
        return target + " " + operator.symbol() + " " + value.describe();
    }
}
