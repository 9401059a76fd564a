package com.qualsim.core.tree;

import com.qualsim.core.branching.BranchCondition;
import com.qualsim.core.effect.Change;
import com.qualsim.core.engine.NodeStatus;
import com.qualsim.core.model.WorldSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A state in the simulation graph. The id, snapshot and status never change; a node discovered
 * again within its layer only gains incoming edges.
 */
public final class TreeNode {

    private final String id;
    private final int layer;
    private final WorldSnapshot snapshot;
    private final NodeStatus status;
    private final String fingerprint;
    private final List<IncomingEdge> incomingEdges = new ArrayList<>();
    private final List<String> childIds = new ArrayList<>();

    TreeNode(String id, int layer, WorldSnapshot snapshot, NodeStatus status, String fingerprint) {
        this.id = id;
        this.layer = layer;
        this.snapshot = snapshot;
        this.status = status;
        this.fingerprint = fingerprint;
    }

    public String id() { return id; }
    public int layer() { return layer; }
    public WorldSnapshot snapshot() { return snapshot; }
    public NodeStatus status() { return status; }
    public String fingerprint() { return fingerprint; }

    public List<IncomingEdge> incomingEdges() {
        return Collections.unmodifiableList(incomingEdges);
    }

    public List<String> childIds() {
        return Collections.unmodifiableList(childIds);
    }

    /** Distinct parent ids in the order the edges were added. */
    public List<String> parentIds() {
        return incomingEdges.stream().map(IncomingEdge::parentId).distinct().toList();
    }

    public String actionName() {
        return incomingEdges.isEmpty() ? null : incomingEdges.get(0).action();
    }

    /** Branch condition of the primary (first) incoming edge. */
    public BranchCondition branchCondition() {
        return incomingEdges.isEmpty() ? null : incomingEdges.get(0).branchCondition();
    }

    /** Change log of the primary (first) incoming edge. */
    public List<Change> changes() {
        return incomingEdges.isEmpty() ? List.of() : incomingEdges.get(0).changes();
    }

    public String error() {
        return incomingEdges.isEmpty() ? null : incomingEdges.get(0).error();
    }

    public boolean isRoot() {
        return incomingEdges.isEmpty();
    }

    public boolean isLeaf() {
        return childIds.isEmpty();
    }

    public boolean isMerged() {
        return incomingEdges.size() > 1;
    }

    void addIncomingEdge(IncomingEdge edge) {
        incomingEdges.add(edge);
    }

    void addChild(String childId) {
        if (!childIds.contains(childId)) {
            childIds.add(childId);
        }
    }

    @Override
    public String toString() {
        return "TreeNode[" + id + ", layer=" + layer + ", status=" + status.id() + ", " + snapshot + "]";
    }
}
