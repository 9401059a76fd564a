package com.qualsim.history;

import com.qualsim.core.model.AttributeValue;
import com.qualsim.core.space.Trend;

import java.util.List;

/**
 * Serialized attribute value.
 */
public record ValueRecord(List<String> levels, Trend trend) {

    public static ValueRecord of(AttributeValue value) {
        return new ValueRecord(value.levels(), value.trend());
    }
}
