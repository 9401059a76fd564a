package com.qualsim.core.condition;

import java.util.List;
import java.util.Map;

/**
 * Tests an action parameter: membership in {@code validValues}, or equality with {@code expected}.
 * Parameter checks never depend on the world state, so they are always definite.
 */
public record ParameterCheck(String parameter, List<String> validValues, String expected) implements Condition {

    public ParameterCheck {
        validValues = validValues == null ? List.of() : List.copyOf(validValues);
    }

    public static ParameterCheck valid(String parameter, List<String> validValues) {
        return new ParameterCheck(parameter, validValues, null);
    }

    public static ParameterCheck equalTo(String parameter, String expected) {
        return new ParameterCheck(parameter, List.of(), expected);
    }

    public boolean test(Map<String, String> parameters) {
        String actual = parameters.get(parameter);
        if (actual == null) {
            return false;
        }
        if (expected != null && !expected.equals(actual)) {
            return false;
        }
        return validValues.isEmpty() || validValues.contains(actual);
    }

    @Override
    public String describe() {
        if (expected != null) {
            return "$" + parameter + " == " + expected;
        }
        return "$" + parameter + " in {" + String.join(", ", validValues) + "}";
    }
}
