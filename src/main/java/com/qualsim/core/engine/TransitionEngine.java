package com.qualsim.core.engine;

import com.qualsim.core.branching.BranchCondition;
import com.qualsim.core.branching.BranchGenerator;
import com.qualsim.core.branching.PostconditionBranch;
import com.qualsim.core.branching.PreconditionBranch;
import com.qualsim.core.condition.Condition;
import com.qualsim.core.condition.ConditionEvaluator;
import com.qualsim.core.condition.Conditions;
import com.qualsim.core.condition.Evaluation;
import com.qualsim.core.constraint.ConstraintChecker;
import com.qualsim.core.constraint.ConstraintReport;
import com.qualsim.core.effect.Change;
import com.qualsim.core.effect.ChangeKind;
import com.qualsim.core.effect.Conditional;
import com.qualsim.core.effect.Effect;
import com.qualsim.core.effect.EffectApplication;
import com.qualsim.core.effect.EffectApplier;
import com.qualsim.core.error.RequiredPostconditionException;
import com.qualsim.core.error.SimulationException;
import com.qualsim.core.error.ValidationException;
import com.qualsim.core.model.Action;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.AttributeValue;
import com.qualsim.core.model.ParameterSpec;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.Trend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a single action to a single snapshot and returns one result per branch.
 * <p>
 * The engine holds no state between calls: the same snapshot, action and parameters always
 * produce the same results in the same order. Precondition success branches come first (each
 * followed by its effect sub-branches), then precondition fail branches.
 */
@Service
public class TransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    private final ConditionEvaluator evaluator;
    private final EffectApplier effectApplier;
    private final BranchGenerator branchGenerator;
    private final ConstraintChecker constraintChecker;

    public TransitionEngine(ConditionEvaluator evaluator, EffectApplier effectApplier,
                            BranchGenerator branchGenerator, ConstraintChecker constraintChecker) {
        this.evaluator = evaluator;
        this.effectApplier = effectApplier;
        this.branchGenerator = branchGenerator;
        this.constraintChecker = constraintChecker;
    }

    /**
     * @param before     snapshot to apply the action to
     * @param action     the action
     * @param parameters supplied parameter values
     * @param scope      knowledge base and object type
     * @return results in deterministic order; a single halting {@link NodeStatus#ERROR} result when the
     *         parameters are invalid or an effect writes an immutable or out-of-space value
     */
    public List<TransitionResult> apply(WorldSnapshot before, Action action,
                                        Map<String, String> parameters, SimulationScope scope) {
        try {
            Map<String, String> resolved = resolveParameters(action, parameters);
            WorldSnapshot working = projectTrends(before, action, scope);

            Condition precondition = Conditions.allOf(action.preconditions());
            Evaluation evaluation = evaluator.evaluate(precondition, working, resolved, scope);
            List<PreconditionBranch> branches;
            if (evaluation.isUnknown()) {
                branches = branchGenerator.splitPrecondition(precondition, working, resolved, scope);
            } else {
                branches = List.of(new PreconditionBranch(working, null, evaluation.isTrue()));
            }

            List<TransitionResult> results = new ArrayList<>();
            for (PreconditionBranch branch : branches) {
                List<BranchCondition> conditions = branch.condition() == null ? List.of() : List.of(branch.condition());
                if (branch.passed()) {
                    applyEffects(before, branch.snapshot(), action.effects(), List.of(), conditions,
                            resolved, scope, results);
                } else {
                    results.add(new TransitionResult(NodeStatus.REJECTED, before, branch.snapshot(),
                            changeLog(before, branch.snapshot(), List.of()), List.of(), List.of(),
                            conditions, null, false));
                }
            }
            log.debug("Action '{}' produced {} results", action.name(), results.size());
            return results;
        } catch (SimulationException e) {
            log.warn("Action '{}' failed: {}", action.name(), e.getMessage());
            return List.of(TransitionResult.fatal(before, e.getMessage()));
        }
    }

    private void applyEffects(WorldSnapshot before, WorldSnapshot snapshot, List<Effect> effects,
                              List<Change> changesSoFar, List<BranchCondition> conditions,
                              Map<String, String> parameters, SimulationScope scope,
                              List<TransitionResult> results) {
        EffectApplication application;
        try {
            application = effectApplier.apply(snapshot, effects, parameters, scope);
        } catch (RequiredPostconditionException e) {
            WorldSnapshot reached = e.getReached() != null ? e.getReached() : snapshot;
            results.add(unsatisfied(before, reached, concat(changesSoFar, e.getAppliedChanges()), conditions,
                    e.getMessage()));
            return;
        }
        List<Change> changes = concat(changesSoFar, application.changes());

        if (application instanceof EffectApplication.Pending pending) {
            List<PostconditionBranch> cases = branchGenerator.splitPostcondition(
                    pending.conditional(), pending.snapshot(), parameters, scope);
            for (PostconditionBranch branch : cases) {
                List<BranchCondition> next = branch.condition() == null
                        ? conditions : concat(conditions, List.of(branch.condition()));
                if (!branch.satisfied()) {
                    String message = new RequiredPostconditionException(
                            pending.conditional().condition().describe()).getMessage();
                    results.add(unsatisfied(before, branch.snapshot(), changes, next, message));
                    continue;
                }
                applyEffects(before, branch.snapshot(), concat(branch.effects(), pending.remaining()),
                        changes, next, parameters, scope, results);
            }
            return;
        }

        WorldSnapshot after = application.snapshot();
        ConstraintReport report = constraintChecker.check(after, scope);
        List<Change> entries = new ArrayList<>(changeLog(before, after, changes));
        for (String violation : report.violations()) {
            entries.add(new Change("constraint", null, violation, ChangeKind.CONSTRAINT));
        }
        NodeStatus status = report.isViolated() ? NodeStatus.CONSTRAINT_VIOLATED : NodeStatus.OK;
        results.add(new TransitionResult(status, before, after, entries, report.violations(),
                report.unresolved(), conditions, null, false));
    }

    private TransitionResult unsatisfied(WorldSnapshot before, WorldSnapshot snapshot, List<Change> changes,
                                         List<BranchCondition> conditions, String message) {
        return new TransitionResult(NodeStatus.ERROR, before, snapshot, changeLog(before, snapshot, changes),
                List.of(), List.of(), conditions, message, false);
    }

    /**
     * Narrowing entries for attributes whose levels differ without an effect writing them,
     * followed by the effect changes.
     */
    private List<Change> changeLog(WorldSnapshot before, WorldSnapshot after, List<Change> effectChanges) {
        Set<String> written = new HashSet<>();
        for (Change change : effectChanges) {
            if (change.kind() == ChangeKind.VALUE) {
                written.add(change.attribute());
            }
        }
        List<Change> result = new ArrayList<>();
        for (var entry : before.values().entrySet()) {
            AttributePath path = entry.getKey();
            AttributeValue old = entry.getValue();
            AttributeValue now = after.value(path);
            if (!written.contains(path.toString()) && !old.levels().equals(now.levels())) {
                result.add(new Change(path.toString(), old.display(), now.display(), ChangeKind.NARROWING));
            }
        }
        result.addAll(effectChanges);
        return result;
    }

    Map<String, String> resolveParameters(Action action, Map<String, String> supplied) {
        Map<String, String> resolved = new LinkedHashMap<>();
        Set<String> declared = new HashSet<>();
        for (ParameterSpec spec : action.parameters()) {
            declared.add(spec.name());
            String value = supplied.get(spec.name());
            if (value == null) {
                value = spec.defaultValue();
            }
            if (value == null) {
                if (spec.required()) {
                    throw new ValidationException("Missing required parameter '" + spec.name()
                            + "' for action '" + action.name() + "'");
                }
                continue;
            }
            if (!spec.accepts(value)) {
                throw new ValidationException("Invalid value '" + value + "' for parameter '" + spec.name()
                        + "' of action '" + action.name() + "', expected one of " + spec.choices());
            }
            resolved.put(spec.name(), value);
        }
        for (String name : supplied.keySet()) {
            if (!declared.contains(name)) {
                throw new ValidationException("Action '" + action.name() + "' has no parameter '" + name + "'");
            }
        }
        return resolved;
    }

    /**
     * Replaces the levels of every attribute the action reads and that carries a trend with the
     * levels reachable along that trend.
     */
    WorldSnapshot projectTrends(WorldSnapshot snapshot, Action action, SimulationScope scope) {
        Set<AttributePath> read = new LinkedHashSet<>();
        for (Condition condition : action.preconditions()) {
            read.addAll(Conditions.targets(condition));
        }
        collectConditionTargets(action.effects(), read);

        Map<AttributePath, List<String>> projected = new LinkedHashMap<>();
        for (AttributePath path : read) {
            AttributeValue value = snapshot.value(path);
            if (value.trend() != Trend.NONE) {
                List<String> levels = scope.space(path).valueSetFromTrend(value.levels(), value.trend());
                if (!levels.equals(value.levels())) {
                    projected.put(path, levels);
                }
            }
        }
        return snapshot.narrow(projected);
    }

    private static void collectConditionTargets(List<Effect> effects, Set<AttributePath> into) {
        for (Effect effect : effects) {
            if (effect instanceof Conditional conditional) {
                into.addAll(Conditions.targets(conditional.condition()));
                collectConditionTargets(conditional.then(), into);
                if (conditional.hasElse()) {
                    collectConditionTargets(conditional.otherwise(), into);
                }
            }
        }
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }
}
