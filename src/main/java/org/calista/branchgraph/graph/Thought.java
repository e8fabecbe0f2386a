package org.calista.branchgraph.graph;

import java.util.List;
import java.util.Objects;

/**
 * Immutable unit of reasoning. {@code id} is derived from {@code content}.
 */
public final class Thought {
    public final String id;
    public final String content;
    public final String branchId;
    public final String kind;
    public final double confidence;
    public final List<String> keyPoints;
    public final long createdAtEpochMs;

    public Thought(String id, String content, String branchId, String kind, double confidence,
                   List<String> keyPoints, long createdAtEpochMs) {
        this.id = Objects.requireNonNull(id, "id");
        this.content = Objects.requireNonNull(content, "content");
        this.branchId = Objects.requireNonNull(branchId, "branchId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.confidence = confidence;
        this.keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        this.createdAtEpochMs = createdAtEpochMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Thought t)) return false;
        return id.equals(t.id)
                && content.equals(t.content)
                && branchId.equals(t.branchId)
                && kind.equals(t.kind)
                && Double.compare(confidence, t.confidence) == 0
                && keyPoints.equals(t.keyPoints)
                && createdAtEpochMs == t.createdAtEpochMs;
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Thought{" + id + " @" + branchId + ", kind=" + kind + ", confidence=" + confidence + '}';
    }
}
