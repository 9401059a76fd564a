package com.qualsim.history;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads history files and rebuilds full node snapshots by replaying deltas from the root.
 */
@Service
public class HistoryReader {

    public SimulationHistory read(Path file) {
        try {
            return HistoryFormat.mapperFor(file).readValue(file.toFile(), SimulationHistory.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read history from " + file, e);
        }
    }

    /**
     * Full snapshot of every node, keyed by node id, in file order. Parents always precede their
     * children in a history file, so a single forward pass is enough.
     *
     * @throws IllegalStateException if a node refers to a parent that has not been seen yet
     */
    public Map<String, Map<String, ValueRecord>> reconstruct(SimulationHistory history) {
        Map<String, Map<String, ValueRecord>> states = new LinkedHashMap<>();
        states.put(history.rootId(), new LinkedHashMap<>(history.root()));
        for (NodeRecord node : history.nodes()) {
            Map<String, ValueRecord> parent = states.get(node.primaryParent());
            if (parent == null) {
                throw new IllegalStateException("Node " + node.id() + " refers to unknown parent "
                        + node.primaryParent());
            }
            Map<String, ValueRecord> state = new LinkedHashMap<>(parent);
            state.putAll(node.delta());
            states.put(node.id(), state);
        }
        return states;
    }
}
