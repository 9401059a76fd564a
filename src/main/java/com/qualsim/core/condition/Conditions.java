package com.qualsim.core.condition;

import com.qualsim.core.model.AttributePath;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static helpers over condition trees.
 */
public final class Conditions {

    private Conditions() {}

    /**
     * Folds a precondition list into one condition; {@code null} when the list is empty.
     */
    public static Condition allOf(List<Condition> conditions) {
        if (conditions.isEmpty()) {
            return null;
        }
        return conditions.size() == 1 ? conditions.get(0) : new And(conditions);
    }

    /**
     * Every attribute the condition reads, in first-seen order.
     */
    public static Set<AttributePath> targets(Condition condition) {
        Set<AttributePath> result = new LinkedHashSet<>();
        collect(condition, result);
        return result;
    }

    private static void collect(Condition condition, Set<AttributePath> into) {
        if (condition instanceof AttributeCheck check) {
            into.add(check.target());
        } else if (condition instanceof And and) {
            and.items().forEach(c -> collect(c, into));
        } else if (condition instanceof Or or) {
            or.items().forEach(c -> collect(c, into));
        } else if (condition instanceof Not not) {
            collect(not.item(), into);
        } else if (condition instanceof Implication implication) {
            collect(implication.antecedent(), into);
            collect(implication.consequent(), into);
        }
    }
}
