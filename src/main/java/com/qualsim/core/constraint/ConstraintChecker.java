package com.qualsim.core.constraint;

import com.qualsim.core.condition.ConditionEvaluator;
import com.qualsim.core.condition.Evaluation;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks an object type's dependency constraints against a post-effect snapshot.
 * Violations are reported, never repaired.
 */
@Component
public class ConstraintChecker {

    private static final Logger log = LoggerFactory.getLogger(ConstraintChecker.class);

    private final ConditionEvaluator evaluator;

    public ConstraintChecker(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ConstraintReport check(WorldSnapshot snapshot, SimulationScope scope) {
        List<DependencyConstraint> constraints = scope.objectType().constraints();
        if (constraints.isEmpty()) {
            return ConstraintReport.CLEAN;
        }
        List<String> violations = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (DependencyConstraint constraint : constraints) {
            Evaluation result = evaluator.evaluate(constraint.asImplication(), snapshot, Map.of(), scope);
            if (result.isFalse()) {
                violations.add(constraint.describe());
            } else if (result.isUnknown()) {
                unresolved.add(constraint.describe());
            }
        }
        if (!violations.isEmpty()) {
            log.debug("Constraint violations: {}", violations);
        }
        return new ConstraintReport(violations, unresolved);
    }
}
