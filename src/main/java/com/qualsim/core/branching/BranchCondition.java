package com.qualsim.core.branching;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.qualsim.core.space.Operator;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records which condition produced a branch: either one attribute comparison or a compound
 * of sub-conditions.
 *
 * @param source        precondition or postcondition
 * @param branchType    which side of the split this branch is
 * @param attribute     compared attribute, {@code null} for compounds
 * @param operator      comparison operator, {@code null} for compounds
 * @param values        compared level(s), empty for compounds
 * @param compoundType  how sub-conditions combine, {@code null} for simple conditions
 * @param subConditions parts of a compound, empty for simple conditions
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BranchCondition(BranchSource source,
                              BranchType branchType,
                              String attribute,
                              Operator operator,
                              List<String> values,
                              CompoundType compoundType,
                              List<BranchCondition> subConditions) {

    public BranchCondition {
        values = values == null ? List.of() : List.copyOf(values);
        subConditions = subConditions == null ? List.of() : List.copyOf(subConditions);
    }

    public static BranchCondition simple(String attribute, Operator operator, List<String> values) {
        return new BranchCondition(null, null, attribute, operator, values, null, List.of());
    }

    /**
     * Combines parts; nested compounds of the same type are flattened and a single part is returned as is.
     */
    public static BranchCondition compound(CompoundType type, List<BranchCondition> parts) {
        List<BranchCondition> flat = new ArrayList<>();
        for (BranchCondition part : parts) {
            if (part.compoundType() == type) {
                flat.addAll(part.subConditions());
            } else {
                flat.add(part);
            }
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return new BranchCondition(null, null, null, null, List.of(), type, flat);
    }

    @JsonIgnore
    public boolean isCompound() {
        return compoundType != null;
    }

    /**
     * Copies this condition, and every sub-condition, with the given provenance.
     */
    public BranchCondition stamp(BranchSource newSource, BranchType newType) {
        List<BranchCondition> subs = subConditions.stream().map(s -> s.stamp(newSource, newType)).toList();
        return new BranchCondition(newSource, newType, attribute, operator, values, compoundType, subs);
    }

    public String describe() {
        if (isCompound()) {
            return subConditions.stream()
                    .map(BranchCondition::describe)
                    .collect(Collectors.joining(" " + compoundType.id() + " ", "(", ")"));
        }
        String rendered = values.size() == 1 ? values.get(0) : "{" + String.join(", ", values) + "}";
        return attribute + " " + operator.symbol() + " " + rendered;
    }
}
