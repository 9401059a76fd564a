package com.qualsim.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qualsim.core.tree.GraphStatistics;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a run: the root's full snapshot followed by per-node deltas in id order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationHistory(String simulationId,
                                String objectType,
                                List<String> actions,
                                String haltReason,
                                GraphStatistics statistics,
                                String rootId,
                                Map<String, ValueRecord> root,
                                List<NodeRecord> nodes) {}
