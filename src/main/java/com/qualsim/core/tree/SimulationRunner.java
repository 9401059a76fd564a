package com.qualsim.core.tree;

import com.qualsim.config.SimulationProperties;
import com.qualsim.core.engine.TransitionEngine;
import com.qualsim.core.engine.TransitionResult;
import com.qualsim.core.error.ValidationException;
import com.qualsim.core.events.EventBus;
import com.qualsim.core.events.SimulationEvent;
import com.qualsim.core.logging.MdcContext;
import com.qualsim.core.metrics.SimulationMetrics;
import com.qualsim.core.model.Action;
import com.qualsim.core.model.KnowledgeBase;
import com.qualsim.core.model.ObjectType;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs an action sequence layer by layer over every expandable leaf.
 * <p>
 * Per-leaf expansion is a pure call into the {@link TransitionEngine} and may run on a worker pool;
 * results are always placed into the graph in leaf order, so node ids and merges do not depend on
 * scheduling. A layer that produces a halting error finishes, then the run stops.
 */
@Service
public class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    private final TransitionEngine engine;
    private final EventBus eventBus;
    private final SimulationMetrics metrics;
    private final SimulationProperties properties;

    public SimulationRunner(TransitionEngine engine, EventBus eventBus,
                            SimulationMetrics metrics, SimulationProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    public static String newSimulationId() {
        return "sim-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * @throws ValidationException if the object type is unknown or an initial value is invalid
     */
    public SimulationGraph run(KnowledgeBase knowledgeBase, SimulationRequest request) {
        ObjectType objectType = knowledgeBase.objectType(request.objectType())
                .orElseThrow(() -> new ValidationException("Unknown object type '" + request.objectType() + "'"));
        SimulationScope scope = new SimulationScope(knowledgeBase, objectType);
        String simulationId = request.simulationId() != null ? request.simulationId() : newSimulationId();

        MdcContext.setSimulation(simulationId);
        ExecutorService executor = properties.getParallelism() > 1
                ? Executors.newFixedThreadPool(properties.getParallelism()) : null;
        try {
            WorldSnapshot initial = WorldSnapshot.initial(scope, request.initialValues());
            SimulationGraph graph = new SimulationGraph(simulationId, objectType.name(), request.actions());
            NodeFactory factory = new NodeFactory(graph);
            TreeNode root = factory.createRoot(initial);

            log.info("Simulation {} started: {} actions on '{}'", simulationId, request.actions().size(),
                    objectType.name());
            eventBus.publish(SimulationEvent.of(SimulationEvent.Type.SIMULATION_STARTED, simulationId, root.id(),
                    Map.of("objectType", objectType.name(), "actions", request.actions().size())));

            List<TreeNode> leaves = List.of(root);
            for (int i = 0; i < request.actions().size(); i++) {
                ActionRequest step = request.actions().get(i);
                int layer = i + 1;
                MdcContext.setLayer(simulationId, step.name(), layer);
                leaves = runLayer(graph, factory, scope, step, layer, leaves, executor);
                if (graph.isHalted()) {
                    break;
                }
                if (graph.size() > properties.getMaxNodes()) {
                    graph.halt("Node limit of " + properties.getMaxNodes() + " exceeded");
                    break;
                }
                if (leaves.isEmpty()) {
                    log.info("No expandable leaves left after '{}'", step.name());
                    break;
                }
            }

            if (graph.isHalted()) {
                String reason = graph.haltReason().orElse("");
                log.warn("Simulation {} halted: {}", simulationId, reason);
                eventBus.publish(SimulationEvent.of(SimulationEvent.Type.SIMULATION_HALTED, simulationId, null,
                        Map.of("reason", reason)));
                metrics.recordSimulationResult("halted");
            } else {
                metrics.recordSimulationResult("completed");
            }
            GraphStatistics stats = graph.statistics();
            log.info("Simulation {} finished: {} nodes, depth {}, width {}, {} merged",
                    simulationId, stats.totalNodes(), stats.depth(), stats.width(), stats.mergedNodes());
            eventBus.publish(SimulationEvent.of(SimulationEvent.Type.SIMULATION_COMPLETED, simulationId, null,
                    Map.of("nodes", stats.totalNodes(), "halted", graph.isHalted())));
            return graph;
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
            MdcContext.clear();
        }
    }

    private List<TreeNode> runLayer(SimulationGraph graph, NodeFactory factory, SimulationScope scope,
                                    ActionRequest step, int layer, List<TreeNode> leaves,
                                    ExecutorService executor) {
        long start = System.currentTimeMillis();
        factory.beginLayer(layer);
        Optional<Action> action = scope.knowledgeBase().action(scope.objectType().name(), step.name());

        List<List<TransitionResult>> expansions;
        if (action.isEmpty()) {
            String message = "Unknown action '" + step.name() + "' for object type '"
                    + scope.objectType().name() + "'";
            expansions = leaves.stream().map(leaf -> List.of(TransitionResult.fatal(leaf.snapshot(), message))).toList();
        } else {
            expansions = expand(graph.simulationId(), layer, leaves, action.get(), step, scope, executor);
        }

        Set<TreeNode> next = new LinkedHashSet<>();
        int created = 0;
        int merged = 0;
        for (int i = 0; i < leaves.size(); i++) {
            TreeNode parent = leaves.get(i);
            for (TransitionResult result : expansions.get(i)) {
                NodeFactory.Placement placement = factory.place(parent, step, result);
                TreeNode node = placement.node();
                if (placement.merged()) {
                    merged++;
                    metrics.recordNodeMerged();
                    eventBus.publish(SimulationEvent.of(SimulationEvent.Type.NODE_MERGED, graph.simulationId(),
                            node.id(), Map.of("parentId", parent.id(), "layer", layer)));
                } else {
                    created++;
                    metrics.recordNodeCreated(node.status().id());
                }
                if (node.status().isExpandable()) {
                    next.add(node);
                }
                if (result.halting()) {
                    graph.halt(result.error());
                }
            }
        }

        int branchPoints = (int) leaves.stream().filter(leaf -> leaf.childIds().size() > 1).count();
        metrics.recordBranchPoints(branchPoints);
        metrics.recordLayerWidth(created);
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordLayerDuration(step.name(), elapsed);

        log.info("Layer {} ({}): {} leaves expanded into {} new nodes, {} merged",
                layer, step, leaves.size(), created, merged);
        eventBus.publish(SimulationEvent.of(SimulationEvent.Type.LAYER_COMPLETED, graph.simulationId(), null,
                Map.of("layer", layer, "action", step.name(), "created", created, "merged", merged)));
        return new ArrayList<>(next);
    }

    private List<List<TransitionResult>> expand(String simulationId, int layer, List<TreeNode> leaves,
                                                Action action, ActionRequest step, SimulationScope scope,
                                                ExecutorService executor) {
        if (executor == null) {
            List<List<TransitionResult>> results = new ArrayList<>();
            for (TreeNode leaf : leaves) {
                results.add(engine.apply(leaf.snapshot(), action, step.parameters(), scope));
            }
            return results;
        }
        List<CompletableFuture<List<TransitionResult>>> futures = leaves.stream()
                .map(leaf -> CompletableFuture.supplyAsync(() -> {
                    MdcContext.setLayer(simulationId, step.name(), layer);
                    try {
                        return engine.apply(leaf.snapshot(), action, step.parameters(), scope);
                    } finally {
                        MdcContext.clear();
                    }
                }, executor))
                .toList();
        List<List<TransitionResult>> results = new ArrayList<>();
        try {
            for (CompletableFuture<List<TransitionResult>> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return results;
    }
}
