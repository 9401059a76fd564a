package com.qualsim.core.condition;

public record Not(Condition item) implements Condition {

    @Override
    public String describe() {
        return "not " + item.describe();
    }
}
