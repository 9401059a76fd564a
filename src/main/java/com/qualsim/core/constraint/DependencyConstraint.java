package com.qualsim.core.constraint;

import com.qualsim.core.condition.Condition;
import com.qualsim.core.condition.Implication;

/**
 * "When {@code condition} holds, {@code requires} must hold as well."
 *
 * @param condition   the triggering condition
 * @param requires    what must hold whenever the condition does
 * @param description optional human-readable label
 */
public record DependencyConstraint(Condition condition, Condition requires, String description) {

    public Implication asImplication() {
        return new Implication(condition, requires);
    }

    public String describe() {
        if (description != null && !description.isBlank()) {
            return description;
        }
        return condition.describe() + " requires " + requires.describe();
    }
}
