package com.qualsim.core.condition;

import java.util.List;

/**
 * {@code antecedent -> consequent}, equivalent to {@code not antecedent or consequent}.
 */
public record Implication(Condition antecedent, Condition consequent) implements Condition {

    public Or asDisjunction() {
        return new Or(List.of(new Not(antecedent), consequent));
    }

    @Override
    public String describe() {
        return "(" + antecedent.describe() + " -> " + consequent.describe() + ")";
    }
}
