package com.qualsim.core.engine;

import com.qualsim.core.branching.BranchCondition;
import com.qualsim.core.effect.Change;
import com.qualsim.core.model.WorldSnapshot;

import java.util.List;

/**
 * Result of applying one action to one snapshot along one branch.
 *
 * @param status                 outcome
 * @param before                 snapshot the action was applied to
 * @param after                  resulting snapshot, {@code null} when the action failed before producing one
 * @param changes                ordered change log relative to {@code before}
 * @param violations             violated dependency constraints
 * @param unresolvedConstraints  constraints that could not be decided
 * @param branchConditions       conditions chosen along this branch, outermost first
 * @param error                  failure message for {@link NodeStatus#ERROR}
 * @param halting                whether this failure stops the simulation after the current layer
 */
public record TransitionResult(NodeStatus status,
                               WorldSnapshot before,
                               WorldSnapshot after,
                               List<Change> changes,
                               List<String> violations,
                               List<String> unresolvedConstraints,
                               List<BranchCondition> branchConditions,
                               String error,
                               boolean halting) {

    public TransitionResult {
        changes = List.copyOf(changes);
        violations = List.copyOf(violations);
        unresolvedConstraints = List.copyOf(unresolvedConstraints);
        branchConditions = List.copyOf(branchConditions);
    }

    /**
     * An action-level failure: no branch survives and the run stops.
     */
    public static TransitionResult fatal(WorldSnapshot before, String error) {
        return new TransitionResult(NodeStatus.ERROR, before, null, List.of(), List.of(), List.of(),
                List.of(), error, true);
    }

    /** The snapshot a node built from this result carries. */
    public WorldSnapshot resultingSnapshot() {
        return after != null ? after : before;
    }

    /** The innermost branch condition, or {@code null} when the action did not branch. */
    public BranchCondition branchCondition() {
        return branchConditions.isEmpty() ? null : branchConditions.get(branchConditions.size() - 1);
    }
}
