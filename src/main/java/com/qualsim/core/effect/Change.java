package com.qualsim.core.effect;

/**
 * One entry of a transition's change log.
 *
 * @param attribute attribute path, suffixed with {@code .trend} for trend changes
 * @param before    rendered value before, may be {@code null}
 * @param after     rendered value after
 * @param kind      what caused the change
 */
public record Change(String attribute, String before, String after, ChangeKind kind) {

    @Override
    public String toString() {
        return attribute + ": " + before + " -> " + after + " [" + kind.id() + "]";
    }
}
