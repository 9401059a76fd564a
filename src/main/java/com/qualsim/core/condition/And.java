package com.qualsim.core.condition;

import java.util.List;
import java.util.stream.Collectors;

public record And(List<Condition> items) implements Condition {

    public And {
        items = List.copyOf(items);
    }

    @Override
    public String describe() {
        return items.stream().map(Condition::describe).collect(Collectors.joining(" and ", "(", ")"));
    }
}
