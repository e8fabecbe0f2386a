package org.calista.branchgraph.graph;

import org.calista.branchgraph.circular.CircularReasoningDetector;
import org.calista.branchgraph.filter.ContradictionBloomFilter;
import org.calista.branchgraph.matrix.SimilarityMatrix;

import java.util.Locale;
import java.util.Map;

public final class GraphStatistics {
    public final int totalBranches;
    public final int totalThoughts;
    public final int activeBranches;
    public final double averageThoughtsPerBranch;
    public final Map<BranchState, Integer> stateDistribution;
    public final long totalEvents;
    public final ContradictionBloomFilter.Stats contradictionFilter;
    public final SimilarityMatrix.Stats similarityMatrix;
    public final CircularReasoningDetector.Stats circularReasoning;

    GraphStatistics(int totalBranches, int totalThoughts, int activeBranches, double averageThoughtsPerBranch,
                    Map<BranchState, Integer> stateDistribution, long totalEvents,
                    ContradictionBloomFilter.Stats contradictionFilter,
                    SimilarityMatrix.Stats similarityMatrix,
                    CircularReasoningDetector.Stats circularReasoning) {
        this.totalBranches = totalBranches;
        this.totalThoughts = totalThoughts;
        this.activeBranches = activeBranches;
        this.averageThoughtsPerBranch = averageThoughtsPerBranch;
        this.stateDistribution = Map.copyOf(stateDistribution);
        this.totalEvents = totalEvents;
        this.contradictionFilter = contradictionFilter;
        this.similarityMatrix = similarityMatrix;
        this.circularReasoning = circularReasoning;
    }

    public String brief() {
        return String.format(Locale.ROOT, "branches=%d (active=%d) thoughts=%d avg/branch=%.2f events=%d",
                totalBranches, activeBranches, totalThoughts, averageThoughtsPerBranch, totalEvents);
    }
}
