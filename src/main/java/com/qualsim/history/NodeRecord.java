package com.qualsim.history;

import com.qualsim.core.engine.NodeStatus;

import java.util.List;
import java.util.Map;

/**
 * One non-root node of a history file.
 *
 * @param id        node id
 * @param layer     layer the node was produced in
 * @param status    node status
 * @param parentIds distinct parents; the first is the primary parent
 * @param edges     one entry per incoming edge
 * @param delta     attributes whose value differs from the primary parent's
 */
public record NodeRecord(String id,
                         int layer,
                         NodeStatus status,
                         List<String> parentIds,
                         List<EdgeRecord> edges,
                         Map<String, ValueRecord> delta) {

    public NodeRecord {
        parentIds = parentIds == null ? List.of() : parentIds;
        edges = edges == null ? List.of() : edges;
        delta = delta == null ? Map.of() : delta;
    }

    public String primaryParent() {
        return edges.isEmpty() ? null : edges.get(0).parentId();
    }
}
