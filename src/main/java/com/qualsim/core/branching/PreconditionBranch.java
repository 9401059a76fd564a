package com.qualsim.core.branching;

import com.qualsim.core.model.WorldSnapshot;

/**
 * One side of a precondition split.
 *
 * @param snapshot  snapshot narrowed to this side
 * @param condition the condition that selects this side
 * @param passed    {@code true} when the precondition holds on this side
 */
public record PreconditionBranch(WorldSnapshot snapshot, BranchCondition condition, boolean passed) {}
