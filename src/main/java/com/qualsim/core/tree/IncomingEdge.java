package com.qualsim.core.tree;

import com.qualsim.core.branching.BranchCondition;
import com.qualsim.core.effect.Change;
import com.qualsim.core.engine.NodeStatus;

import java.util.List;
import java.util.Map;

/**
 * One way of reaching a node: the parent, the action taken and what it changed along this edge.
 * A merged node has one edge per parent branch that produced it.
 *
 * @param parentId              id of the parent node
 * @param action                action name
 * @param parameters            parameters the action ran with
 * @param status                outcome of the action along this edge
 * @param branchConditions      branch conditions chosen along this edge, outermost first
 * @param changes               ordered change log relative to the parent
 * @param violations            violated dependency constraints
 * @param unresolvedConstraints constraints that could not be decided
 * @param error                 failure message, {@code null} unless the status is error
 */
public record IncomingEdge(String parentId,
                           String action,
                           Map<String, String> parameters,
                           NodeStatus status,
                           List<BranchCondition> branchConditions,
                           List<Change> changes,
                           List<String> violations,
                           List<String> unresolvedConstraints,
                           String error) {

    public IncomingEdge {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        branchConditions = List.copyOf(branchConditions);
        changes = List.copyOf(changes);
        violations = List.copyOf(violations);
        unresolvedConstraints = List.copyOf(unresolvedConstraints);
    }

    /** The innermost branch condition, or {@code null} when the action did not branch here. */
    public BranchCondition branchCondition() {
        return branchConditions.isEmpty() ? null : branchConditions.get(branchConditions.size() - 1);
    }
}
