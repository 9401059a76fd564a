package com.qualsim.core.model;

import java.util.List;

/**
 * Declared parameter of an action.
 *
 * @param name         parameter name
 * @param required     whether a value must be supplied
 * @param choices      allowed values, empty when unrestricted
 * @param defaultValue value used when an optional parameter is omitted, may be {@code null}
 */
public record ParameterSpec(String name, boolean required, List<String> choices, String defaultValue) {

    public ParameterSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public boolean accepts(String value) {
        return choices.isEmpty() || choices.contains(value);
    }
}
