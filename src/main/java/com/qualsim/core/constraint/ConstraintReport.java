package com.qualsim.core.constraint;

import java.util.List;

/**
 * @param violations constraints that definitely do not hold
 * @param unresolved constraints that cannot be decided because values are ambiguous
 */
public record ConstraintReport(List<String> violations, List<String> unresolved) {

    public static final ConstraintReport CLEAN = new ConstraintReport(List.of(), List.of());

    public ConstraintReport {
        violations = List.copyOf(violations);
        unresolved = List.copyOf(unresolved);
    }

    public boolean isViolated() {
        return !violations.isEmpty();
    }

    public boolean hasUnresolved() {
        return !unresolved.isEmpty();
    }
}
