package org.calista.branchgraph.graph;

import org.calista.branchgraph.filter.ContradictionCheck;

import java.util.Optional;

public final class AddThoughtResult {
    public final String thoughtId;
    public final String branchId;
    /** True when the content was already stored; nothing changed. */
    public final boolean duplicate;
    public final ContradictionCheck contradiction;
    private final OverlapWarning overlapWarning;

    AddThoughtResult(String thoughtId, String branchId, boolean duplicate,
                     ContradictionCheck contradiction, OverlapWarning overlapWarning) {
        this.thoughtId = thoughtId;
        this.branchId = branchId;
        this.duplicate = duplicate;
        this.contradiction = contradiction == null ? ContradictionCheck.none() : contradiction;
        this.overlapWarning = overlapWarning;
    }

    static AddThoughtResult duplicateOf(Thought existing) {
        return new AddThoughtResult(existing.id, existing.branchId, true, ContradictionCheck.none(), null);
    }

    public Optional<OverlapWarning> overlapWarning() {
        return Optional.ofNullable(overlapWarning);
    }

    @Override
    public String toString() {
        return "AddThoughtResult{thoughtId=" + thoughtId + ", branchId=" + branchId + ", duplicate=" + duplicate
                + ", contradiction=" + contradiction + ", overlapWarning=" + overlapWarning + '}';
    }
}
