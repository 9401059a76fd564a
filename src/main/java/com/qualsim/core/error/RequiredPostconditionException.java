package com.qualsim.core.error;

import com.qualsim.core.effect.Change;
import com.qualsim.core.model.WorldSnapshot;

import java.util.List;

/**
 * Raised when a conditional effect without an else branch is definitely not satisfied.
 * Only the branch that hit it fails; the simulation keeps going.
 * <p>
 * Carries the snapshot and change log reached by the effects that ran before the conditional.
 */
public class RequiredPostconditionException extends SimulationException {

    private final transient WorldSnapshot reached;
    private final transient List<Change> appliedChanges;

    public RequiredPostconditionException(String condition) {
        this(condition, null, List.of());
    }

    public RequiredPostconditionException(String condition, WorldSnapshot reached, List<Change> appliedChanges) {
        super("Required postcondition not satisfied: " + condition
                + (appliedChanges.isEmpty() ? "" : " (after " + appliedChanges.size() + " applied change(s))"));
        this.reached = reached;
        this.appliedChanges = List.copyOf(appliedChanges);
    }

    /** Snapshot after the effects preceding the conditional, {@code null} when not known. */
    public WorldSnapshot getReached() {
        return reached;
    }

    public List<Change> getAppliedChanges() {
        return appliedChanges;
    }
}
