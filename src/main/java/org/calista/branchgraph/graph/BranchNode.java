package org.calista.branchgraph.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable branch record owned by {@link BranchGraph}. Never leaves the store; readers get {@link Branch}.
 */
final class BranchNode {
    final String id;
    final String parentId;
    final long createdAtEpochMs;
    final Set<String> childIds = new LinkedHashSet<>();
    final List<String> thoughtIds = new ArrayList<>();
    BranchState state = BranchState.ACTIVE;
    double priority;
    double confidence;

    // semantic profile, null until the first embedded thought
    float[] center;
    int profileCount;
    List<String> keywords = List.of();
    long profileUpdatedAtEpochMs;

    BranchNode(String id, String parentId, long createdAtEpochMs, double priority, double confidence) {
        this.id = id;
        this.parentId = parentId;
        this.createdAtEpochMs = createdAtEpochMs;
        this.priority = priority;
        this.confidence = confidence;
    }

    boolean hasProfile() {
        return center != null;
    }

    Branch snapshot() {
        SemanticProfile profile = hasProfile()
                ? new SemanticProfile(center, keywords, profileCount, profileUpdatedAtEpochMs)
                : null;
        return new Branch(id, parentId, new ArrayList<>(childIds), thoughtIds, state, priority, confidence,
                createdAtEpochMs, profile);
    }
}
