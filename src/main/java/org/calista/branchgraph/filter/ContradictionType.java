package org.calista.branchgraph.filter;

public enum ContradictionType {
    /** Negative text about a concept previously asserted positively. */
    NEGATION,
    /** Positive text about a concept previously asserted negatively. */
    AFFIRMATION,
    /** Adjacent concept pair seen before in the opposite order. */
    RELATIONAL
}
