package com.qualsim.core.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One step of a simulation: an action name and its parameters.
 */
public record ActionRequest(String name, Map<String, String> parameters) {

    public ActionRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name must not be blank");
        }
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ActionRequest of(String name) {
        return new ActionRequest(name, Map.of());
    }

    /**
     * Parses {@code name} or {@code name:key=value,key=value}.
     */
    public static ActionRequest parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Action must not be blank");
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            return of(text.trim());
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        for (String pair : text.substring(colon + 1).split(",")) {
            if (pair.isBlank()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value in action parameters, got '" + pair + "'");
            }
            parameters.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return new ActionRequest(text.substring(0, colon).trim(), parameters);
    }

    @Override
    public String toString() {
        if (parameters.isEmpty()) {
            return name;
        }
        return parameters.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", name + ":", ""));
    }
}
