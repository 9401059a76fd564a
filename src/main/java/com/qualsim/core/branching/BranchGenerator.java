package com.qualsim.core.branching;

import com.qualsim.core.condition.And;
import com.qualsim.core.condition.AttributeCheck;
import com.qualsim.core.condition.Condition;
import com.qualsim.core.condition.ConditionEvaluator;
import com.qualsim.core.condition.Evaluation;
import com.qualsim.core.condition.Implication;
import com.qualsim.core.condition.Not;
import com.qualsim.core.condition.Or;
import com.qualsim.core.effect.Conditional;
import com.qualsim.core.effect.Effect;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.Operator;
import com.qualsim.core.space.QualitativeSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a snapshot on an undecided condition into mutually exclusive, narrowed alternatives.
 * <p>
 * Satisfying and violating assignments are derived recursively. A conjunction is satisfied by
 * the product of its undecided items' satisfying assignments and violated by any one of them;
 * a disjunction the other way around (De Morgan). Assignments constraining the same attribute
 * are intersected and dropped when the intersection is empty.
 */
@Component
public class BranchGenerator {

    private static final Logger log = LoggerFactory.getLogger(BranchGenerator.class);

    private final ConditionEvaluator evaluator;

    public BranchGenerator(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Success branches first, then fail branches.
     */
    public List<PreconditionBranch> splitPrecondition(Condition precondition, WorldSnapshot snapshot,
                                                      Map<String, String> parameters, SimulationScope scope) {
        List<PreconditionBranch> branches = new ArrayList<>();
        for (Narrowing n : satisfying(precondition, snapshot, parameters, scope)) {
            branches.add(new PreconditionBranch(snapshot.narrow(n.sets()),
                    stamp(n.condition(), BranchSource.PRECONDITION, BranchType.SUCCESS), true));
        }
        for (Narrowing n : violating(precondition, snapshot, parameters, scope)) {
            branches.add(new PreconditionBranch(snapshot.narrow(n.sets()),
                    stamp(n.condition(), BranchSource.PRECONDITION, BranchType.FAIL), false));
        }
        log.debug("Precondition '{}' split into {} branches", precondition.describe(), branches.size());
        return branches;
    }

    /**
     * One branch per satisfiable case of the if/elif chain, followed by the remainder: the else
     * case, or an unsatisfied branch when the conditional has no else.
     */
    public List<PostconditionBranch> splitPostcondition(Conditional conditional, WorldSnapshot snapshot,
                                                        Map<String, String> parameters, SimulationScope scope) {
        Conditional.Chain chain = conditional.chain();
        List<PostconditionBranch> branches = new ArrayList<>();
        splitChain(chain, 0, snapshot, new LinkedHashSet<>(), parameters, scope, branches);
        log.debug("Conditional '{}' split into {} branches", conditional.describe(), branches.size());
        return branches;
    }

    public List<Narrowing> satisfying(Condition condition, WorldSnapshot snapshot,
                                      Map<String, String> parameters, SimulationScope scope) {
        return derive(condition, true, snapshot, parameters, scope);
    }

    public List<Narrowing> violating(Condition condition, WorldSnapshot snapshot,
                                     Map<String, String> parameters, SimulationScope scope) {
        return derive(condition, false, snapshot, parameters, scope);
    }

    private void splitChain(Conditional.Chain chain, int index, WorldSnapshot remaining, Set<AttributePath> narrowed,
                            Map<String, String> parameters, SimulationScope scope,
                            List<PostconditionBranch> out) {
        if (index == chain.cases().size()) {
            List<Effect> effects = chain.hasElse() ? chain.elseEffects() : List.of();
            out.add(new PostconditionBranch(remaining, remainderCondition(remaining, narrowed, BranchType.ELSE),
                    effects, chain.hasElse()));
            return;
        }
        Conditional.Case current = chain.cases().get(index);
        BranchType type = index == 0 ? BranchType.IF : BranchType.ELIF;
        Evaluation evaluation = evaluator.evaluate(current.condition(), remaining, parameters, scope);

        if (evaluation.isTrue()) {
            out.add(new PostconditionBranch(remaining, remainderCondition(remaining, narrowed, type),
                    current.effects(), true));
            return;
        }
        if (evaluation.isFalse()) {
            splitChain(chain, index + 1, remaining, narrowed, parameters, scope, out);
            return;
        }
        for (Narrowing n : satisfying(current.condition(), remaining, parameters, scope)) {
            out.add(new PostconditionBranch(remaining.narrow(n.sets()),
                    stamp(n.condition(), BranchSource.POSTCONDITION, type), current.effects(), true));
        }
        for (Narrowing n : violating(current.condition(), remaining, parameters, scope)) {
            Set<AttributePath> next = new LinkedHashSet<>(narrowed);
            next.addAll(n.sets().keySet());
            splitChain(chain, index + 1, remaining.narrow(n.sets()), next, parameters, scope, out);
        }
    }

    private BranchCondition remainderCondition(WorldSnapshot snapshot, Set<AttributePath> narrowed, BranchType type) {
        if (narrowed.isEmpty()) {
            return null;
        }
        List<BranchCondition> parts = new ArrayList<>();
        for (AttributePath path : narrowed) {
            parts.add(BranchCondition.simple(path.toString(), Operator.IN, snapshot.value(path).levels()));
        }
        return stamp(BranchCondition.compound(CompoundType.AND, parts), BranchSource.POSTCONDITION, type);
    }

    private List<Narrowing> derive(Condition condition, boolean satisfy, WorldSnapshot snapshot,
                                   Map<String, String> parameters, SimulationScope scope) {
        Evaluation evaluation = evaluator.evaluate(condition, snapshot, parameters, scope);
        if (evaluation.isTrue()) {
            return satisfy ? List.of(Narrowing.NONE) : List.of();
        }
        if (evaluation.isFalse()) {
            return satisfy ? List.of() : List.of(Narrowing.NONE);
        }
        if (condition instanceof AttributeCheck check) {
            return List.of(narrowCheck(check, satisfy, snapshot, parameters, scope));
        }
        if (condition instanceof Not not) {
            return derive(not.item(), !satisfy, snapshot, parameters, scope);
        }
        if (condition instanceof Implication implication) {
            return derive(implication.asDisjunction(), satisfy, snapshot, parameters, scope);
        }

        List<Condition> items;
        boolean product;
        if (condition instanceof And and) {
            items = and.items();
            product = satisfy;
        } else if (condition instanceof Or or) {
            items = or.items();
            product = !satisfy;
        } else {
            throw new IllegalStateException("Condition cannot be undecided: " + condition.describe());
        }

        List<Condition> undecided = items.stream()
                .filter(item -> evaluator.evaluate(item, snapshot, parameters, scope).isUnknown())
                .toList();

        if (!product) {
            List<Narrowing> union = new ArrayList<>();
            for (Condition item : undecided) {
                union.addAll(derive(item, satisfy, snapshot, parameters, scope));
            }
            return union;
        }

        List<Narrowing> combined = List.of(Narrowing.NONE);
        for (Condition item : undecided) {
            List<Narrowing> next = new ArrayList<>();
            for (Narrowing left : combined) {
                for (Narrowing right : derive(item, satisfy, snapshot, parameters, scope)) {
                    left.combine(right, scope).ifPresent(next::add);
                }
            }
            combined = next;
        }
        return combined;
    }

    private Narrowing narrowCheck(AttributeCheck check, boolean satisfy, WorldSnapshot snapshot,
                                  Map<String, String> parameters, SimulationScope scope) {
        QualitativeSpace space = scope.space(check.target());
        List<String> current = snapshot.value(check.target()).levels();
        List<String> matching = space.intersect(current, evaluator.satisfyingLevels(check, parameters, scope));
        List<String> levels = satisfy ? matching : space.subtract(current, matching);
        Operator operator = satisfy ? check.operator() : check.operator().negate();
        BranchCondition condition = BranchCondition.simple(
                check.target().toString(), operator, check.value().resolve(parameters));
        return Narrowing.of(check.target(), levels, condition);
    }

    private static BranchCondition stamp(BranchCondition condition, BranchSource source, BranchType type) {
        return condition == null ? null : condition.stamp(source, type);
    }
}
