package com.qualsim.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a simulation runs.
 *
 * @param type         what happened
 * @param simulationId the run this event belongs to
 * @param nodeId       the node concerned, {@code null} for run- and layer-level events
 * @param payload      event details, keyed by name
 * @param timestamp    when the event occurred
 */
public record SimulationEvent(Type type,
                              String simulationId,
                              String nodeId,
                              Map<String, Object> payload,
                              Instant timestamp) {

    public enum Type {
        SIMULATION_STARTED("simulation.started"),
        LAYER_COMPLETED("layer.completed"),
        NODE_MERGED("node.merged"),
        SIMULATION_HALTED("simulation.halted"),
        SIMULATION_COMPLETED("simulation.completed");

        private final String id;

        Type(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        /** No further events follow for the same run. */
        public boolean isFinal() {
            return this == SIMULATION_COMPLETED;
        }
    }

    public SimulationEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static SimulationEvent of(Type type, String simulationId, String nodeId, Map<String, Object> payload) {
        return new SimulationEvent(type, simulationId, nodeId, payload, Instant.now());
    }

    public String eventType() {
        return type.id();
    }

    public Object get(String key) {
        return payload.get(key);
    }

    @Override
    public String toString() {
        return type.id() + (nodeId == null ? "" : " " + nodeId) + " " + payload;
    }
}
