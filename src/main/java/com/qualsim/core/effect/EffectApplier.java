package com.qualsim.core.effect;

import com.qualsim.core.condition.ConditionEvaluator;
import com.qualsim.core.condition.Evaluation;
import com.qualsim.core.error.DomainException;
import com.qualsim.core.error.ImmutableWriteException;
import com.qualsim.core.error.RequiredPostconditionException;
import com.qualsim.core.model.AttributeSpec;
import com.qualsim.core.model.AttributeValue;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.QualitativeSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Applies an ordered effect list to a snapshot.
 * <p>
 * Conditionals with a definite outcome are resolved in place. The first conditional whose
 * outcome is unknown stops execution and is handed back as {@link EffectApplication.Pending}.
 */
@Component
public class EffectApplier {

    private static final Logger log = LoggerFactory.getLogger(EffectApplier.class);

    private final ConditionEvaluator evaluator;

    public EffectApplier(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @throws ImmutableWriteException        if an effect writes an immutable attribute
     * @throws DomainException                if a written value is not in the attribute's space
     * @throws RequiredPostconditionException if a conditional without else is definitely false
     */
    public EffectApplication apply(WorldSnapshot snapshot, List<Effect> effects,
                                   Map<String, String> parameters, SimulationScope scope) {
        Deque<Effect> queue = new ArrayDeque<>(effects);
        List<Change> changes = new ArrayList<>();
        WorldSnapshot current = snapshot;

        while (!queue.isEmpty()) {
            Effect effect = queue.pollFirst();
            if (effect instanceof SetAttribute set) {
                current = setAttribute(current, set, parameters, scope, changes);
            } else if (effect instanceof SetTrend trend) {
                current = setTrend(current, trend, changes);
            } else if (effect instanceof Conditional conditional) {
                Evaluation evaluation = evaluator.evaluate(conditional.condition(), current, parameters, scope);
                if (evaluation.isUnknown()) {
                    log.debug("Conditional '{}' undecided on {}", conditional.describe(), evaluation.witnesses());
                    return new EffectApplication.Pending(current, changes, conditional,
                            new ArrayList<>(queue), evaluation);
                }
                List<Effect> chosen;
                if (evaluation.isTrue()) {
                    chosen = conditional.then();
                } else if (conditional.hasElse()) {
                    chosen = conditional.otherwise();
                } else {
                    throw new RequiredPostconditionException(conditional.condition().describe(), current, changes);
                }
                for (int i = chosen.size() - 1; i >= 0; i--) {
                    queue.addFirst(chosen.get(i));
                }
            }
        }
        return new EffectApplication.Completed(current, changes);
    }

    private WorldSnapshot setAttribute(WorldSnapshot snapshot, SetAttribute set, Map<String, String> parameters,
                                       SimulationScope scope, List<Change> changes) {
        AttributeSpec spec = scope.spec(set.target());
        if (!spec.mutable()) {
            throw new ImmutableWriteException(set.target().toString());
        }
        List<String> resolved = set.value().resolve(parameters);
        QualitativeSpace space = scope.space(set.target());
        if (resolved.size() != 1) {
            throw new DomainException("Attribute '" + set.target() + "' must be set to a single level, got " + resolved);
        }
        String level = resolved.get(0);
        if (!space.contains(level)) {
            throw new DomainException("Value '" + level + "' for attribute '" + set.target()
                    + "' is not in space '" + space.name() + "' " + space.levels());
        }
        AttributeValue before = snapshot.value(set.target());
        changes.add(new Change(set.target().toString(), before.display(), level, ChangeKind.VALUE));
        return snapshot.with(set.target(), before.withLevels(List.of(level)));
    }

    private WorldSnapshot setTrend(WorldSnapshot snapshot, SetTrend set, List<Change> changes) {
        AttributeValue before = snapshot.value(set.target());
        changes.add(new Change(set.target() + ".trend", before.trend().id(), set.direction().id(), ChangeKind.TREND));
        return snapshot.with(set.target(), before.withTrend(set.direction()));
    }
}
