package com.qualsim.core.model;

import com.qualsim.core.error.ValidationException;
import com.qualsim.core.space.QualitativeSpace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable mapping from every attribute of an object to its current value.
 * Modifications always produce a new snapshot.
 */
public final class WorldSnapshot {

    private final Map<AttributePath, AttributeValue> values;

    public WorldSnapshot(Map<AttributePath, AttributeValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Builds the root snapshot from declared defaults; {@code unknown} defaults expand to the whole space.
     *
     * @param scope     object type and knowledge base
     * @param overrides initial values that replace defaults, keyed by attribute path
     */
    public static WorldSnapshot initial(SimulationScope scope, Map<AttributePath, List<String>> overrides) {
        Map<AttributePath, AttributeValue> values = new LinkedHashMap<>();
        for (var entry : scope.objectType().attributes().entrySet()) {
            AttributePath path = entry.getKey();
            QualitativeSpace space = scope.space(path);
            AttributeSpec spec = entry.getValue();
            List<String> levels = spec.defaultsToUnknown()
                    ? space.levels()
                    : List.of(space.levels().get(space.indexOf(spec.defaultValue())));
            values.put(path, AttributeValue.of(levels));
        }
        for (var override : overrides.entrySet()) {
            AttributePath path = override.getKey();
            QualitativeSpace space = scope.space(path);
            List<String> levels = override.getValue().size() == 1
                    && AttributeSpec.UNKNOWN.equals(override.getValue().get(0))
                    ? space.levels()
                    : space.ordered(override.getValue());
            if (levels.isEmpty()) {
                throw new ValidationException("Initial value for '" + path + "' is empty");
            }
            values.put(path, AttributeValue.of(levels));
        }
        return new WorldSnapshot(values);
    }

    public Map<AttributePath, AttributeValue> values() {
        return values;
    }

    public boolean has(AttributePath path) {
        return values.containsKey(path);
    }

    public AttributeValue value(AttributePath path) {
        AttributeValue value = values.get(path);
        if (value == null) {
            throw new ValidationException("Snapshot has no attribute '" + path + "'");
        }
        return value;
    }

    public WorldSnapshot with(AttributePath path, AttributeValue value) {
        if (!values.containsKey(path)) {
            throw new ValidationException("Snapshot has no attribute '" + path + "'");
        }
        Map<AttributePath, AttributeValue> copy = new LinkedHashMap<>(values);
        copy.put(path, value);
        return new WorldSnapshot(copy);
    }

    /**
     * Replaces the level sets of the given attributes, keeping their trends.
     */
    public WorldSnapshot narrow(Map<AttributePath, List<String>> levels) {
        if (levels.isEmpty()) {
            return this;
        }
        Map<AttributePath, AttributeValue> copy = new LinkedHashMap<>(values);
        levels.forEach((path, set) -> copy.put(path, value(path).withLevels(set)));
        return new WorldSnapshot(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorldSnapshot other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
