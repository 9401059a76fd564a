package com.qualsim.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Address of an attribute: {@code part.attribute} for part attributes, or a bare name for globals.
 *
 * @param part      owning part, {@code null} for a global attribute
 * @param attribute attribute name
 */
public record AttributePath(String part, String attribute) implements Comparable<AttributePath> {

    public AttributePath {
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("Attribute name must not be blank");
        }
        if (part != null && part.isBlank()) {
            part = null;
        }
    }

    public static AttributePath global(String attribute) {
        return new AttributePath(null, attribute);
    }

    public static AttributePath of(String part, String attribute) {
        return new AttributePath(part, attribute);
    }

    @JsonCreator
    public static AttributePath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Attribute path must not be blank");
        }
        String trimmed = path.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return global(trimmed);
        }
        if (trimmed.indexOf('.', dot + 1) >= 0) {
            throw new IllegalArgumentException("Attribute path has too many segments: " + path);
        }
        return new AttributePath(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    public boolean isGlobal() {
        return part == null;
    }

    @Override
    public int compareTo(AttributePath other) {
        return toString().compareTo(other.toString());
    }

    @JsonValue
    @Override
    public String toString() {
        return part == null ? attribute : part + "." + attribute;
    }
}
