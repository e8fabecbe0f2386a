package org.calista.branchgraph.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BranchAnalyticsTest {

    private BranchGraph graph;
    private BranchAnalytics analytics;

    @BeforeEach
    void setUp() {
        graph = BranchGraph.builder().build();
        analytics = new BranchAnalytics(graph);
    }

    private void add(String branch, String... contents) {
        if (!graph.hasBranch(branch)) graph.createBranchWithId(branch, null);
        for (String c : contents) graph.addThought(ThoughtInput.builder(c).branchId(branch).build());
    }

    @Test
    void branchesWithoutThoughtsAreIgnored() {
        add("a", "cats hunt mice at night");
        graph.createBranchWithId("empty", null);

        assertTrue(analytics.compareProfiles().comparisons.isEmpty());
        assertTrue(analytics.suggestMerges().isEmpty());
        assertTrue(analytics.detectDrift().isEmpty());
    }

    @Test
    void compareProfilesRanksPairs() {
        add("a", "cats hunt mice at night");
        add("b", "cats hunt mice at night often");
        add("c", "database indexes speed queries");

        BranchAnalytics.ProfileComparison cmp = analytics.compareProfiles();
        assertEquals(3, cmp.comparisons.size());

        BranchAnalytics.Pair top = cmp.mostSimilarPairs.get(0);
        assertEquals("a", top.branch1);
        assertEquals("b", top.branch2);
        assertTrue(top.similarity > 0.0);
        assertTrue(top.sharedConcepts.contains("cats"), top.sharedConcepts.toString());
        assertEquals("c", cmp.mostDistinctBranches.get(0));
    }

    @Test
    void similarBranchesAreSuggestedForMerge() {
        add("a", "cats hunt mice at night");
        add("b", "cats hunt mice at night often");
        add("c", "database indexes speed queries");

        List<BranchAnalytics.MergeSuggestion> merges = analytics.suggestMerges();
        assertEquals(1, merges.size());
        BranchAnalytics.MergeSuggestion m = merges.get(0);
        assertEquals(List.of("a", "b"), m.branches);
        // 5 shared words out of 5 and 6
        assertEquals(5 / Math.sqrt(30), m.similarity, 1e-12);
        assertEquals("High semantic similarity (91.3%)", m.reason);
        assertTrue(m.potentialBenefit.startsWith("Combine 2 thoughts with "), m.potentialBenefit);

        assertTrue(analytics.suggestMerges(0.95).isEmpty());
    }

    @Test
    void driftTiersFollowScore() {
        add("steady", "cats hunt mice", "cats hunt mice often", "cats hunt mice daily");
        add("moderate", "alpha beta gamma", "delta epsilon zeta", "theta iota kappa");
        add("strong", "one red apple", "two blue boats", "three green cars",
                "four yellow dogs", "five purple eggs", "six orange fans");

        List<BranchAnalytics.DriftReport> drift = analytics.detectDrift();
        assertEquals(List.of("strong", "moderate"), drift.stream().map(d -> d.branchId).toList());

        // 4 of 25 early/recent pairs are the same thought
        assertEquals(21.0 / 25.0, drift.get(0).driftScore, 1e-12);
        assertEquals("Consider splitting into separate branches", drift.get(0).recommendation);

        // 3 of 9 pairs are the same thought
        assertEquals(6.0 / 9.0, drift.get(1).driftScore, 1e-12);
        assertEquals("Moderate drift from original focus", drift.get(1).reason);
    }

    @Test
    void shortBranchesAreNotCheckedForDrift() {
        add("short", "alpha beta gamma", "delta epsilon zeta");
        assertTrue(analytics.detectDrift(0.0).isEmpty());
    }
}
