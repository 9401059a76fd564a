package com.qualsim.core.tree;

import com.qualsim.core.model.AttributePath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to start a run.
 *
 * @param simulationId  run id; generated when {@code null}
 * @param objectType    object type to simulate
 * @param actions       actions applied in order, one layer each
 * @param initialValues starting values overriding declared defaults
 */
public record SimulationRequest(String simulationId,
                                String objectType,
                                List<ActionRequest> actions,
                                Map<AttributePath, List<String>> initialValues) {

    public SimulationRequest {
        if (objectType == null || objectType.isBlank()) {
            throw new IllegalArgumentException("Object type must not be blank");
        }
        actions = List.copyOf(actions);
        initialValues = initialValues == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(initialValues));
    }

    public static SimulationRequest of(String objectType, List<ActionRequest> actions) {
        return new SimulationRequest(null, objectType, actions, Map.of());
    }
}
