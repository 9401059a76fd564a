package com.qualsim.core.effect;

import com.qualsim.core.condition.ValueRef;
import com.qualsim.core.model.AttributePath;

/**
 * Writes a single level to an attribute. The trend is left as it is.
 */
public record SetAttribute(AttributePath target, ValueRef value) implements Effect {

    @Override
    public String describe() {
        return target + " := " + value.describe();
    }
}
