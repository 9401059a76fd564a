package com.qualsim.core.model;

import com.qualsim.core.space.Trend;

import java.util.List;

/**
 * Current value of an attribute: one level when known, several when ambiguous, plus a trend.
 *
 * @param levels possible levels in space order, never empty
 * @param trend  direction of change
 */
public record AttributeValue(List<String> levels, Trend trend) {

    public AttributeValue {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("Attribute value needs at least one level");
        }
        levels = List.copyOf(levels);
        trend = trend == null ? Trend.NONE : trend;
    }

    public static AttributeValue of(String level) {
        return new AttributeValue(List.of(level), Trend.NONE);
    }

    public static AttributeValue of(List<String> levels) {
        return new AttributeValue(levels, Trend.NONE);
    }

    /** One level and no pending trend. */
    public boolean isKnown() {
        return levels.size() == 1 && trend == Trend.NONE;
    }

    public boolean isValueSet() {
        return levels.size() > 1;
    }

    public AttributeValue withLevels(List<String> newLevels) {
        return new AttributeValue(newLevels, trend);
    }

    public AttributeValue withTrend(Trend newTrend) {
        return new AttributeValue(levels, newTrend);
    }

    /**
     * Renders the levels as {@code full} or {@code {low, medium}}.
     */
    public String display() {
        return levels.size() == 1 ? levels.get(0) : "{" + String.join(", ", levels) + "}";
    }

    @Override
    public String toString() {
        return trend == Trend.NONE ? display() : display() + " (" + trend.id() + ")";
    }
}
