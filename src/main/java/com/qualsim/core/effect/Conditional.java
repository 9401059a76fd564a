package com.qualsim.core.effect;

import com.qualsim.core.condition.Condition;
import com.qualsim.core.condition.Conditions;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if condition then ... else ...}. The else list is {@code null} when absent, which makes the
 * condition a required postcondition. An else list holding exactly one conditional over the same
 * attributes is an {@code elif}.
 */
public record Conditional(Condition condition, List<Effect> then, List<Effect> otherwise) implements Effect {

    public Conditional {
        then = List.copyOf(then);
        otherwise = otherwise == null ? null : List.copyOf(otherwise);
    }

    public boolean hasElse() {
        return otherwise != null;
    }

    /**
     * Flattens an if/elif/.../else chain into its cases and the terminal else.
     */
    public Chain chain() {
        List<Case> cases = new ArrayList<>();
        Conditional current = this;
        while (true) {
            cases.add(new Case(current.condition(), current.then()));
            Conditional next = current.elif();
            if (next == null) {
                return new Chain(cases, current.otherwise());
            }
            current = next;
        }
    }

    private Conditional elif() {
        if (otherwise == null || otherwise.size() != 1
                || !(otherwise.get(0) instanceof Conditional nested)) {
            return null;
        }
        return Conditions.targets(nested.condition()).equals(Conditions.targets(condition)) ? nested : null;
    }

    @Override
    public String describe() {
        return "if " + condition.describe();
    }

    public record Case(Condition condition, List<Effect> effects) {}

    /**
     * @param cases       cases in declaration order
     * @param elseEffects effects of the final else, {@code null} when there is none
     */
    public record Chain(List<Case> cases, List<Effect> elseEffects) {

        public boolean hasElse() {
            return elseEffects != null;
        }
    }
}
