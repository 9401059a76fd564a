package com.qualsim.core.effect;

import com.qualsim.core.condition.Evaluation;
import com.qualsim.core.model.WorldSnapshot;

import java.util.List;

/**
 * Outcome of running an effect list: either every effect applied, or execution stopped at a
 * conditional whose condition is unknown and the caller has to branch.
 */
public sealed interface EffectApplication {

    WorldSnapshot snapshot();

    List<Change> changes();

    record Completed(WorldSnapshot snapshot, List<Change> changes) implements EffectApplication {
        public Completed {
            changes = List.copyOf(changes);
        }
    }

    /**
     * @param snapshot    state after the effects preceding the conditional
     * @param changes     changes recorded so far
     * @param conditional the conditional that could not be decided
     * @param remaining   effects that follow the conditional
     * @param evaluation  the unknown evaluation, with its witnesses
     */
    record Pending(WorldSnapshot snapshot, List<Change> changes, Conditional conditional,
                   List<Effect> remaining, Evaluation evaluation) implements EffectApplication {
        public Pending {
            changes = List.copyOf(changes);
            remaining = List.copyOf(remaining);
        }
    }
}
