package org.calista.branchgraph.graph;

public final class ThoughtMatch {
    public final String thoughtId;
    public final String branchId;

    public ThoughtMatch(String thoughtId, String branchId) {
        this.thoughtId = thoughtId;
        this.branchId = branchId;
    }

    @Override
    public String toString() {
        return thoughtId + "@" + branchId;
    }
}
