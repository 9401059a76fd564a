package com.qualsim.core.tree;

import com.qualsim.core.engine.NodeStatus;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The DAG produced by a run: nodes in id order, starting at the root {@code state0}.
 * Only the runner's {@link NodeFactory} adds nodes; callers get a read-only view.
 */
public final class SimulationGraph {

    private final String simulationId;
    private final String objectType;
    private final List<ActionRequest> actions;
    private final Map<String, TreeNode> nodes = new LinkedHashMap<>();
    private String haltReason;

    SimulationGraph(String simulationId, String objectType, List<ActionRequest> actions) {
        this.simulationId = simulationId;
        this.objectType = objectType;
        this.actions = List.copyOf(actions);
    }

    public String simulationId() { return simulationId; }
    public String objectType() { return objectType; }
    public List<ActionRequest> actions() { return actions; }

    public Collection<TreeNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public Optional<TreeNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public TreeNode root() {
        return nodes.values().iterator().next();
    }

    public List<TreeNode> leaves() {
        return nodes.values().stream().filter(TreeNode::isLeaf).toList();
    }

    public List<TreeNode> children(String id) {
        TreeNode node = nodes.get(id);
        if (node == null) {
            return List.of();
        }
        return node.childIds().stream().map(nodes::get).toList();
    }

    public List<TreeNode> layer(int layer) {
        return nodes.values().stream().filter(n -> n.layer() == layer).toList();
    }

    /** Number of layers, root layer included. */
    public int layerCount() {
        return nodes.values().stream().mapToInt(TreeNode::layer).max().orElse(-1) + 1;
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public Optional<String> haltReason() {
        return Optional.ofNullable(haltReason);
    }

    public GraphStatistics statistics() {
        int depth = layerCount();
        int width = 0;
        for (int i = 0; i < depth; i++) {
            width = Math.max(width, layer(i).size());
        }
        int leaves = 0;
        int branchPoints = 0;
        int successful = 0;
        int failed = 0;
        int merged = 0;
        int edges = 0;
        for (TreeNode node : nodes.values()) {
            if (node.isLeaf()) leaves++;
            if (node.childIds().size() > 1) branchPoints++;
            if (node.status() == NodeStatus.OK) successful++;
            else failed++;
            if (node.isMerged()) merged++;
            edges += node.incomingEdges().size();
        }
        return new GraphStatistics(nodes.size(), depth, width, leaves, branchPoints,
                successful, failed, merged, edges);
    }

    void add(TreeNode node) {
        nodes.put(node.id(), node);
    }

    void halt(String reason) {
        if (haltReason == null) {
            haltReason = reason;
        }
    }
}
