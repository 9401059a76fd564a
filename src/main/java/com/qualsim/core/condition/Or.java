package com.qualsim.core.condition;

import java.util.List;
import java.util.stream.Collectors;

public record Or(List<Condition> items) implements Condition {

    public Or {
        items = List.copyOf(items);
    }

    @Override
    public String describe() {
        return items.stream().map(Condition::describe).collect(Collectors.joining(" or ", "(", ")"));
    }
}
