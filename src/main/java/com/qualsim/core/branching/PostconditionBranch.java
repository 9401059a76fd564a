package com.qualsim.core.branching;

import com.qualsim.core.effect.Effect;
import com.qualsim.core.model.WorldSnapshot;

import java.util.List;

/**
 * One case of a conditional-effect split.
 *
 * @param snapshot  snapshot narrowed to this case
 * @param condition the condition that selects this case
 * @param effects   effects to apply on this case
 * @param satisfied {@code false} for the remainder of a conditional that has no else
 */
public record PostconditionBranch(WorldSnapshot snapshot, BranchCondition condition,
                                  List<Effect> effects, boolean satisfied) {

    public PostconditionBranch {
        effects = List.copyOf(effects);
    }
}
