package org.calista.branchgraph.graph;

import java.util.List;

/**
 * Snapshot of a branch's semantic centre: running mean of thought embeddings plus top TF-IDF keywords.
 */
public final class SemanticProfile {
    private final float[] centerEmbedding;
    public final List<String> keywords;
    public final int thoughtCount;
    public final long lastUpdatedEpochMs;

    public SemanticProfile(float[] centerEmbedding, List<String> keywords, int thoughtCount, long lastUpdatedEpochMs) {
        this.centerEmbedding = centerEmbedding.clone();
        this.keywords = List.copyOf(keywords);
        this.thoughtCount = thoughtCount;
        this.lastUpdatedEpochMs = lastUpdatedEpochMs;
    }

    /** Returns a copy. */
    public float[] centerEmbedding() {
        return centerEmbedding.clone();
    }

    public int dimension() {
        return centerEmbedding.length;
    }
}
