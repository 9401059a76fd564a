package com.qualsim.core.effect;

/**
 * A state change declared by an action.
 */
public sealed interface Effect permits SetAttribute, SetTrend, Conditional {

    String describe();
}
