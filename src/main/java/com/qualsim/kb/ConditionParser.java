package com.qualsim.kb;

import com.fasterxml.jackson.databind.JsonNode;
import com.qualsim.core.condition.And;
import com.qualsim.core.condition.AttributeCheck;
import com.qualsim.core.condition.Condition;
import com.qualsim.core.condition.Implication;
import com.qualsim.core.condition.Not;
import com.qualsim.core.condition.Or;
import com.qualsim.core.condition.ParameterCheck;
import com.qualsim.core.condition.ValueRef;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.space.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads condition trees from their YAML/JSON form.
 * <p>
 * Supported {@code type}s: {@code attribute_check}, {@code parameter_valid}, {@code parameter_equals},
 * {@code and}, {@code or}, {@code not}, {@code implication}. A value starting with {@code $} refers to
 * an action parameter.
 */
public final class ConditionParser {

    private ConditionParser() {}

    public static Condition parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Condition must be an object, got " + node);
        }
        String type = text(node, "type");
        return switch (type) {
            case "attribute_check" -> new AttributeCheck(
                    AttributePath.parse(text(node, "attribute")),
                    node.hasNonNull("operator") ? Operator.parse(node.get("operator").asText()) : Operator.EQUALS,
                    valueRef(node.get("value")));
            case "parameter_valid" -> ParameterCheck.valid(text(node, "parameter"), stringList(node.get("values")));
            case "parameter_equals" -> ParameterCheck.equalTo(text(node, "parameter"), text(node, "value"));
            case "and" -> new And(parseList(node.get("conditions")));
            case "or" -> new Or(parseList(node.get("conditions")));
            case "not" -> new Not(parse(node.get("condition")));
            case "implication" -> new Implication(parse(node.get("if")), parse(node.get("then")));
            default -> throw new IllegalArgumentException("Unknown condition type '" + type + "'");
        };
    }

    public static List<Condition> parseList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return List.of(parse(node));
        }
        List<Condition> result = new ArrayList<>();
        for (JsonNode item : node) {
            result.add(parse(item));
        }
        return result;
    }

    static ValueRef valueRef(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing 'value'");
        }
        if (node.isArray()) {
            return ValueRef.levels(stringList(node));
        }
        String value = node.asText();
        if (value.startsWith("$")) {
            return ValueRef.parameter(value.substring(1));
        }
        return ValueRef.level(value);
    }

    static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return List.of(node.asText());
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : node) {
            result.add(item.asText());
        }
        return result;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' in " + node);
        }
        return value.asText();
    }
}
