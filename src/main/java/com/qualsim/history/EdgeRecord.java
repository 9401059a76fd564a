package com.qualsim.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qualsim.core.branching.BranchCondition;
import com.qualsim.core.effect.Change;
import com.qualsim.core.engine.NodeStatus;
import com.qualsim.core.tree.IncomingEdge;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record EdgeRecord(String parentId,
                         String action,
                         Map<String, String> parameters,
                         NodeStatus status,
                         List<BranchCondition> branchConditions,
                         List<Change> changes,
                         List<String> violations,
                         List<String> unresolvedConstraints,
                         String error) {

    public EdgeRecord {
        parameters = parameters == null ? Map.of() : parameters;
        branchConditions = branchConditions == null ? List.of() : branchConditions;
        changes = changes == null ? List.of() : changes;
        violations = violations == null ? List.of() : violations;
        unresolvedConstraints = unresolvedConstraints == null ? List.of() : unresolvedConstraints;
    }

    public static EdgeRecord of(IncomingEdge edge) {
        return new EdgeRecord(edge.parentId(), edge.action(), edge.parameters(), edge.status(),
                edge.branchConditions(), edge.changes(), edge.violations(), edge.unresolvedConstraints(),
                edge.error());
    }
}
