package com.qualsim.history;

import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.AttributeValue;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.tree.ActionRequest;
import com.qualsim.core.tree.SimulationGraph;
import com.qualsim.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a simulation graph as a compact history: full root snapshot plus one delta per node
 * against its primary parent.
 */
@Service
public class HistoryWriter {

    private static final Logger log = LoggerFactory.getLogger(HistoryWriter.class);

    public SimulationHistory toHistory(SimulationGraph graph) {
        TreeNode root = graph.root();
        List<NodeRecord> nodes = new ArrayList<>();
        for (TreeNode node : graph.nodes()) {
            if (node.isRoot()) {
                continue;
            }
            TreeNode parent = graph.node(node.incomingEdges().get(0).parentId())
                    .orElseThrow(() -> new IllegalStateException("Dangling parent of " + node.id()));
            nodes.add(new NodeRecord(node.id(), node.layer(), node.status(), node.parentIds(),
                    node.incomingEdges().stream().map(EdgeRecord::of).toList(),
                    delta(parent.snapshot(), node.snapshot())));
        }
        return new SimulationHistory(graph.simulationId(), graph.objectType(),
                graph.actions().stream().map(ActionRequest::toString).toList(),
                graph.haltReason().orElse(null), graph.statistics(),
                root.id(), full(root.snapshot()), nodes);
    }

    /**
     * @return the file written
     */
    public Path write(SimulationGraph graph, Path file) {
        SimulationHistory history = toHistory(graph);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            HistoryFormat.mapperFor(file).writeValue(file.toFile(), history);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write history to " + file, e);
        }
        log.info("Wrote history of {} ({} nodes) to {}", graph.simulationId(), graph.size(), file);
        return file;
    }

    public static Map<String, ValueRecord> full(WorldSnapshot snapshot) {
        Map<String, ValueRecord> result = new LinkedHashMap<>();
        snapshot.values().forEach((path, value) -> result.put(path.toString(), ValueRecord.of(value)));
        return result;
    }

    static Map<String, ValueRecord> delta(WorldSnapshot parent, WorldSnapshot child) {
        Map<String, ValueRecord> result = new LinkedHashMap<>();
        for (Map.Entry<AttributePath, AttributeValue> entry : child.values().entrySet()) {
            if (!entry.getValue().equals(parent.value(entry.getKey()))) {
                result.put(entry.getKey().toString(), ValueRecord.of(entry.getValue()));
            }
        }
        return result;
    }
}
