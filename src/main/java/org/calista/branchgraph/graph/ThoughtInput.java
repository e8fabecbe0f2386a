package org.calista.branchgraph.graph;

import org.calista.branchgraph.events.CrossRefKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Request to add a thought. Built through {@link #builder(String)}; checked by {@link ThoughtInputValidator}.
 *
 * <p>{@code branchId} null: a new branch is created under {@code parentBranchId} (default "main").
 * {@code confidence} null: the configured default applies.</p>
 */
public final class ThoughtInput {
    public final String content;
    public final String branchId;
    public final String parentBranchId;
    public final String kind;
    public final Double confidence;
    public final List<String> keyPoints;
    public final List<CrossRef> crossRefs;

    private ThoughtInput(Builder b) {
        this.content = b.content;
        this.branchId = b.branchId;
        this.parentBranchId = b.parentBranchId;
        this.kind = b.kind;
        this.confidence = b.confidence;
        this.keyPoints = b.keyPoints == null ? null : new ArrayList<>(b.keyPoints);
        this.crossRefs = List.copyOf(b.crossRefs);
    }

    public static Builder builder(String content) {
        return new Builder(content);
    }

    public static final class CrossRef {
        public final String toBranch;
        public final CrossRefKind kind;
        public final String reason;
        public final double strength;

        public CrossRef(String toBranch, CrossRefKind kind, String reason, double strength) {
            this.toBranch = toBranch;
            this.kind = kind;
            this.reason = reason;
            this.strength = strength;
        }
    }

    public static final class Builder {
        private final String content;
        private String branchId;
        private String parentBranchId;
        private String kind = "analysis";
        private Double confidence;
        private List<String> keyPoints = List.of();
        private final List<CrossRef> crossRefs = new ArrayList<>();

        private Builder(String content) {
            this.content = content;
        }

        public Builder branchId(String v) {
            this.branchId = v;
            return this;
        }

        public Builder parentBranchId(String v) {
            this.parentBranchId = v;
            return this;
        }

        public Builder kind(String v) {
            this.kind = v;
            return this;
        }

        public Builder confidence(double v) {
            this.confidence = v;
            return this;
        }

        public Builder keyPoints(List<String> v) {
            this.keyPoints = v;
            return this;
        }

        public Builder crossRef(String toBranch, CrossRefKind kind, String reason, double strength) {
            this.crossRefs.add(new CrossRef(toBranch, kind, reason, strength));
            return this;
        }

        public Builder crossRef(CrossRef ref) {
            this.crossRefs.add(Objects.requireNonNull(ref, "ref"));
            return this;
        }

        public ThoughtInput build() {
            return new ThoughtInput(this);
        }
    }
}
