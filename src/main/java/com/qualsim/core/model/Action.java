package com.qualsim.core.model;

import com.qualsim.core.condition.Condition;
import com.qualsim.core.effect.Effect;

import java.util.List;

/**
 * A named operation on an object type: parameters, preconditions and effects.
 * The precondition list is read as a conjunction.
 *
 * @param name          action name, unique per object type
 * @param objectType    object type this action applies to
 * @param parameters    declared parameters
 * @param preconditions conditions that must hold before the effects run
 * @param effects       effects applied in order
 */
public record Action(String name,
                     String objectType,
                     List<ParameterSpec> parameters,
                     List<Condition> preconditions,
                     List<Effect> effects) {

    public Action {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name must not be blank");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        effects = effects == null ? List.of() : List.copyOf(effects);
    }
}
