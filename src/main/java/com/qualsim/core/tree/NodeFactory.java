package com.qualsim.core.tree;

import com.qualsim.core.engine.NodeStatus;
import com.qualsim.core.engine.TransitionResult;
import com.qualsim.core.model.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Allocates node ids and folds equivalent branches of one layer into a single node.
 * <p>
 * Two results of the same layer merge when their status and snapshot fingerprint match.
 * Error nodes never merge, and nothing merges across layers. Methods are synchronized so the
 * id counter and the layer index stay consistent even if callers are concurrent.
 */
public class NodeFactory {

    private static final Logger log = LoggerFactory.getLogger(NodeFactory.class);

    private final SimulationGraph graph;
    private final Map<String, TreeNode> layerIndex = new HashMap<>();
    private int nextId;
    private int layer;

    public NodeFactory(SimulationGraph graph) {
        this.graph = graph;
    }

    public synchronized TreeNode createRoot(WorldSnapshot snapshot) {
        if (graph.size() > 0) {
            throw new IllegalStateException("Graph already has a root");
        }
        TreeNode root = new TreeNode(nextId(), 0, snapshot, NodeStatus.OK, Fingerprint.of(snapshot));
        graph.add(root);
        return root;
    }

    /**
     * Starts a new layer; merge candidates from the previous layer are forgotten.
     */
    public synchronized void beginLayer(int layerNumber) {
        this.layer = layerNumber;
        layerIndex.clear();
    }

    /**
     * Adds the child described by {@code result} below {@code parent}, or merges it into an
     * equivalent node already produced in this layer.
     */
    public synchronized Placement place(TreeNode parent, ActionRequest action, TransitionResult result) {
        WorldSnapshot snapshot = result.resultingSnapshot();
        String fingerprint = Fingerprint.of(snapshot);
        IncomingEdge edge = new IncomingEdge(parent.id(), action.name(), action.parameters(), result.status(),
                result.branchConditions(), result.changes(), result.violations(),
                result.unresolvedConstraints(), result.error());

        String key = result.status().id() + ":" + fingerprint;
        TreeNode existing = result.status() == NodeStatus.ERROR ? null : layerIndex.get(key);
        if (existing != null) {
            existing.addIncomingEdge(edge);
            parent.addChild(existing.id());
            log.debug("Merged branch from {} into {}", parent.id(), existing.id());
            return new Placement(existing, true);
        }

        TreeNode node = new TreeNode(nextId(), layer, snapshot, result.status(), fingerprint);
        node.addIncomingEdge(edge);
        parent.addChild(node.id());
        graph.add(node);
        if (result.status() != NodeStatus.ERROR) {
            layerIndex.put(key, node);
        }
        return new Placement(node, false);
    }

    private String nextId() {
        return "state" + nextId++;
    }

    /**
     * @param node   the created or existing node
     * @param merged {@code true} when the result was folded into an existing node
     */
    public record Placement(TreeNode node, boolean merged) {}
}
