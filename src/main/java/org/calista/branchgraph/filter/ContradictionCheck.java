package org.calista.branchgraph.filter;

import java.util.List;

/**
 * Pre-filter verdict. {@code potentialContradiction} is probabilistic: false positives are possible,
 * a confirmed contradiction needs a semantic check downstream.
 */
public final class ContradictionCheck {

    private static final ContradictionCheck NONE = new ContradictionCheck(false, List.of());

    public final boolean potentialContradiction;
    public final List<ContradictionType> types;

    public ContradictionCheck(boolean potentialContradiction, List<ContradictionType> types) {
        this.potentialContradiction = potentialContradiction;
        this.types = types == null ? List.of() : List.copyOf(types);
    }

    public static ContradictionCheck none() {
        return NONE;
    }

    @Override
    public String toString() {
        return "ContradictionCheck{potentialContradiction=" + potentialContradiction + ", types=" + types + '}';
    }
}
