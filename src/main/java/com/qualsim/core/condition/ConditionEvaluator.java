package com.qualsim.core.condition;

import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.QualitativeSpace;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Three-valued evaluation of conditions against a snapshot.
 * <p>
 * An attribute check is TRUE when every possible level of the attribute satisfies it,
 * FALSE when none does, and UNKNOWN otherwise. The snapshot is read literally; trend
 * projection happens before evaluation, in the transition engine.
 */
@Component
public class ConditionEvaluator {

    public Evaluation evaluate(Condition condition, WorldSnapshot snapshot,
                               Map<String, String> parameters, SimulationScope scope) {
        if (condition == null) {
            return Evaluation.TRUE;
        }
        if (condition instanceof AttributeCheck check) {
            return evaluateCheck(check, snapshot, parameters, scope);
        }
        if (condition instanceof ParameterCheck check) {
            return Evaluation.of(check.test(parameters));
        }
        if (condition instanceof And and) {
            return evaluateAnd(and.items(), snapshot, parameters, scope);
        }
        if (condition instanceof Or or) {
            return evaluateOr(or.items(), snapshot, parameters, scope);
        }
        if (condition instanceof Not not) {
            return evaluate(not.item(), snapshot, parameters, scope).negate();
        }
        if (condition instanceof Implication implication) {
            return evaluate(implication.asDisjunction(), snapshot, parameters, scope);
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition);
    }

    /**
     * Levels of the checked attribute's space that satisfy the check.
     */
    public List<String> satisfyingLevels(AttributeCheck check, Map<String, String> parameters,
                                         SimulationScope scope) {
        QualitativeSpace space = scope.space(check.target());
        return space.expand(check.operator(), check.value().resolve(parameters));
    }

    private Evaluation evaluateCheck(AttributeCheck check, WorldSnapshot snapshot,
                                     Map<String, String> parameters, SimulationScope scope) {
        List<String> current = snapshot.value(check.target()).levels();
        Set<String> satisfying = new HashSet<>(satisfyingLevels(check, parameters, scope));
        long hits = current.stream().filter(satisfying::contains).count();
        if (hits == current.size()) {
            return Evaluation.TRUE;
        }
        if (hits == 0) {
            return Evaluation.FALSE;
        }
        return Evaluation.unknown(Set.of(check.target()));
    }

    private Evaluation evaluateAnd(List<Condition> items, WorldSnapshot snapshot,
                                   Map<String, String> parameters, SimulationScope scope) {
        Set<AttributePath> witnesses = new LinkedHashSet<>();
        for (Condition item : items) {
            Evaluation result = evaluate(item, snapshot, parameters, scope);
            if (result.isFalse()) {
                return Evaluation.FALSE;
            }
            witnesses.addAll(result.witnesses());
        }
        return witnesses.isEmpty() ? Evaluation.TRUE : Evaluation.unknown(witnesses);
    }

    private Evaluation evaluateOr(List<Condition> items, WorldSnapshot snapshot,
                                  Map<String, String> parameters, SimulationScope scope) {
        Set<AttributePath> witnesses = new LinkedHashSet<>();
        boolean anyUnknown = false;
        for (Condition item : items) {
            Evaluation result = evaluate(item, snapshot, parameters, scope);
            if (result.isTrue()) {
                return Evaluation.TRUE;
            }
            if (result.isUnknown()) {
                anyUnknown = true;
                witnesses.addAll(result.witnesses());
            }
        }
        return anyUnknown ? Evaluation.unknown(witnesses) : Evaluation.FALSE;
    }
}
