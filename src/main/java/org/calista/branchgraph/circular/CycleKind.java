package org.calista.branchgraph.circular;

public enum CycleKind {
    /** Explicit reference cycle found by depth-first search. */
    DIRECT,
    /** Two thoughts that each assume what the other concludes. */
    PREMISE,
    /** Longer reference cycle found through transitive closure. */
    INDIRECT
}
