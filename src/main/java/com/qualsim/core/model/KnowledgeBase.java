package com.qualsim.core.model;

import com.qualsim.core.space.QualitativeSpace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only collection of spaces, object types and actions. Safe to share across threads.
 */
public final class KnowledgeBase {

    private final Map<String, QualitativeSpace> spaces;
    private final Map<String, ObjectType> objectTypes;
    private final List<Action> actions;

    public KnowledgeBase(Map<String, QualitativeSpace> spaces,
                         Map<String, ObjectType> objectTypes,
                         List<Action> actions) {
        this.spaces = Collections.unmodifiableMap(new LinkedHashMap<>(spaces));
        this.objectTypes = Collections.unmodifiableMap(new LinkedHashMap<>(objectTypes));
        this.actions = List.copyOf(actions);
    }

    public Map<String, QualitativeSpace> spaces() {
        return spaces;
    }

    public Map<String, ObjectType> objectTypes() {
        return objectTypes;
    }

    public List<Action> actions() {
        return actions;
    }

    public Optional<QualitativeSpace> space(String name) {
        return Optional.ofNullable(spaces.get(name));
    }

    public Optional<ObjectType> objectType(String name) {
        return Optional.ofNullable(objectTypes.get(name));
    }

    public Optional<Action> action(String objectType, String name) {
        return actions.stream()
                .filter(a -> a.name().equals(name) && a.objectType().equals(objectType))
                .findFirst();
    }

    public List<Action> actionsFor(String objectType) {
        List<Action> result = new ArrayList<>();
        for (Action action : actions) {
            if (action.objectType().equals(objectType)) {
                result.add(action);
            }
        }
        return result;
    }
}
