package org.calista.branchgraph.graph;

import java.util.Locale;

/**
 * Advisory: the new thought sits closer to another branch's semantic centre than to its own.
 */
public final class OverlapWarning {
    public final String suggestedBranch;
    public final double currentSimilarity;
    public final double suggestedSimilarity;

    public OverlapWarning(String suggestedBranch, double currentSimilarity, double suggestedSimilarity) {
        this.suggestedBranch = suggestedBranch;
        this.currentSimilarity = currentSimilarity;
        this.suggestedSimilarity = suggestedSimilarity;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "OverlapWarning{suggested=%s, current=%.3f, suggestedSim=%.3f}",
                suggestedBranch, currentSimilarity, suggestedSimilarity);
    }
}
