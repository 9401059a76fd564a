package com.qualsim.core.condition;

import com.qualsim.core.error.ValidationException;

import java.util.List;
import java.util.Map;

/**
 * Right-hand side of a comparison: literal levels or a reference to an action parameter.
 *
 * @param levels    literal levels, empty when {@code parameter} is set
 * @param parameter parameter name, {@code null} for literals
 */
public record ValueRef(List<String> levels, String parameter) {

    public ValueRef {
        levels = levels == null ? List.of() : List.copyOf(levels);
        if (parameter == null && levels.isEmpty()) {
            throw new IllegalArgumentException("Value reference needs a level or a parameter");
        }
    }

    public static ValueRef level(String level) {
        return new ValueRef(List.of(level), null);
    }

    public static ValueRef levels(List<String> levels) {
        return new ValueRef(levels, null);
    }

    public static ValueRef parameter(String name) {
        return new ValueRef(List.of(), name);
    }

    public boolean isParameter() {
        return parameter != null;
    }

    public List<String> resolve(Map<String, String> parameters) {
        if (parameter == null) {
            return levels;
        }
        String value = parameters.get(parameter);
        if (value == null) {
            throw new ValidationException("Missing value for parameter '" + parameter + "'");
        }
        return List.of(value);
    }

    public String describe() {
        if (parameter != null) {
            return "$" + parameter;
        }
        return levels.size() == 1 ? levels.get(0) : "{" + String.join(", ", levels) + "}";
    }
}
