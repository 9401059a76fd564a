package com.qualsim.core.branching;

import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.space.QualitativeSpace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Level sets that a branch restricts attributes to, together with the condition that justifies them.
 */
public record Narrowing(Map<AttributePath, List<String>> sets, BranchCondition condition) {

    public static final Narrowing NONE = new Narrowing(Map.of(), null);

    public Narrowing {
        sets = Collections.unmodifiableMap(new LinkedHashMap<>(sets));
    }

    public static Narrowing of(AttributePath path, List<String> levels, BranchCondition condition) {
        return new Narrowing(Map.of(path, levels), condition);
    }

    /**
     * Conjunction of two narrowings. Sets on the same attribute are intersected; an empty
     * intersection means the combination is unsatisfiable.
     */
    public Optional<Narrowing> combine(Narrowing other, SimulationScope scope) {
        Map<AttributePath, List<String>> merged = new LinkedHashMap<>(sets);
        for (var entry : other.sets().entrySet()) {
            List<String> existing = merged.get(entry.getKey());
            if (existing == null) {
                merged.put(entry.getKey(), entry.getValue());
                continue;
            }
            QualitativeSpace space = scope.space(entry.getKey());
            List<String> intersection = space.intersect(existing, entry.getValue());
            if (intersection.isEmpty()) {
                return Optional.empty();
            }
            merged.put(entry.getKey(), intersection);
        }
        BranchCondition combined;
        if (condition == null) {
            combined = other.condition();
        } else if (other.condition() == null) {
            combined = condition;
        } else {
            combined = BranchCondition.compound(CompoundType.AND, List.of(condition, other.condition()));
        }
        return Optional.of(new Narrowing(merged, combined));
    }
}
