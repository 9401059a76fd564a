package com.qualsim.core.effect;

import com.qualsim.core.model.AttributePath;
import com.qualsim.core.space.Trend;

public record SetTrend(AttributePath target, Trend direction) implements Effect {

    @Override
    public String describe() {
        return target + ".trend := " + direction.id();
    }
}
