package com.qualsim.core.model;

import com.qualsim.core.error.ValidationException;
import com.qualsim.core.space.QualitativeSpace;

/**
 * The knowledge base and object type a simulation runs against; resolves attribute declarations.
 *
 * @param knowledgeBase loaded knowledge base
 * @param objectType    simulated object type
 */
public record SimulationScope(KnowledgeBase knowledgeBase, ObjectType objectType) {

    public AttributeSpec spec(AttributePath path) {
        return objectType.attribute(path)
                .orElseThrow(() -> new ValidationException(
                        "Unknown attribute '" + path + "' on object type '" + objectType.name() + "'"));
    }

    public QualitativeSpace space(AttributePath path) {
        String spaceName = spec(path).space();
        return knowledgeBase.space(spaceName)
                .orElseThrow(() -> new ValidationException(
                        "Attribute '" + path + "' references unknown space '" + spaceName + "'"));
    }
}
