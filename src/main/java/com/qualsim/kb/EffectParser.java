package com.qualsim.kb;

import com.fasterxml.jackson.databind.JsonNode;
import com.qualsim.core.effect.Conditional;
import com.qualsim.core.effect.Effect;
import com.qualsim.core.effect.SetAttribute;
import com.qualsim.core.effect.SetTrend;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.space.Trend;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads effect lists. A {@code conditional} may carry an {@code elif} list of
 * {@code {condition, then}} entries and an optional {@code else}; elifs are nested into the else
 * slot of the preceding case.
 */
public final class EffectParser {

    private EffectParser() {}

    public static List<Effect> parseList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return List.of(parse(node));
        }
        List<Effect> result = new ArrayList<>();
        for (JsonNode item : node) {
            result.add(parse(item));
        }
        return result;
    }

    public static Effect parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Effect must be an object, got " + node);
        }
        String type = ConditionParser.text(node, "type");
        return switch (type) {
            case "set_attribute" -> new SetAttribute(
                    AttributePath.parse(ConditionParser.text(node, "attribute")),
                    ConditionParser.valueRef(node.get("value")));
            case "set_trend" -> new SetTrend(
                    AttributePath.parse(ConditionParser.text(node, "attribute")),
                    Trend.parse(node.hasNonNull("direction")
                            ? node.get("direction").asText() : ConditionParser.text(node, "trend")));
            case "conditional" -> conditional(node);
            default -> throw new IllegalArgumentException("Unknown effect type '" + type + "'");
        };
    }

    private static Conditional conditional(JsonNode node) {
        List<Effect> tail = node.has("else") ? parseList(node.get("else")) : null;
        JsonNode elifs = node.get("elif");
        if (elifs != null && elifs.isArray()) {
            for (int i = elifs.size() - 1; i >= 0; i--) {
                JsonNode elif = elifs.get(i);
                tail = List.of(new Conditional(ConditionParser.parse(elif.get("condition")),
                        parseList(elif.get("then")), tail));
            }
        }
        return new Conditional(ConditionParser.parse(node.get("condition")), parseList(node.get("then")), tail);
    }
}
