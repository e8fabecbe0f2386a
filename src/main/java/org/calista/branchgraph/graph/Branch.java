package org.calista.branchgraph.graph;

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a branch at the time it was read.
 */
public final class Branch {
    public final String id;
    /** Null only for the root branch. */
    public final String parentId;
    public final List<String> childIds;
    public final List<String> thoughtIds;
    public final BranchState state;
    public final double priority;
    public final double confidence;
    public final long createdAtEpochMs;
    private final SemanticProfile semanticProfile;

    Branch(String id, String parentId, List<String> childIds, List<String> thoughtIds, BranchState state,
           double priority, double confidence, long createdAtEpochMs, SemanticProfile semanticProfile) {
        this.id = id;
        this.parentId = parentId;
        this.childIds = List.copyOf(childIds);
        this.thoughtIds = List.copyOf(thoughtIds);
        this.state = state;
        this.priority = priority;
        this.confidence = confidence;
        this.createdAtEpochMs = createdAtEpochMs;
        this.semanticProfile = semanticProfile;
    }

    public Optional<SemanticProfile> semanticProfile() {
        return Optional.ofNullable(semanticProfile);
    }

    public int size() {
        return thoughtIds.size();
    }

    @Override
    public String toString() {
        return "Branch{" + id + ", parent=" + parentId + ", state=" + state + ", thoughts=" + thoughtIds.size() + '}';
    }
}
