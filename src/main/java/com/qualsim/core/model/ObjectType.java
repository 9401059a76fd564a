package com.qualsim.core.model;

import com.qualsim.core.constraint.DependencyConstraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An object type: parts with attributes, global attributes and dependency constraints.
 * Attribute order follows declaration order, parts first.
 */
public final class ObjectType {

    private final String name;
    private final Map<AttributePath, AttributeSpec> attributes;
    private final List<DependencyConstraint> constraints;

    public ObjectType(String name, Map<AttributePath, AttributeSpec> attributes,
                      List<DependencyConstraint> constraints) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object type name must not be blank");
        }
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public String name() {
        return name;
    }

    public Map<AttributePath, AttributeSpec> attributes() {
        return attributes;
    }

    public List<DependencyConstraint> constraints() {
        return constraints;
    }

    public Optional<AttributeSpec> attribute(AttributePath path) {
        return Optional.ofNullable(attributes.get(path));
    }

    public List<String> parts() {
        return attributes.keySet().stream()
                .filter(p -> !p.isGlobal())
                .map(AttributePath::part)
                .distinct()
                .toList();
    }

    @Override
    public String toString() {
        return "ObjectType[" + name + ", attributes=" + attributes.keySet() + "]";
    }
}
