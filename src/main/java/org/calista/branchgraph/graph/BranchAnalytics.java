package org.calista.branchgraph.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.text.TermExtractor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only, cross-branch analysis on top of {@link BranchGraph}: profile comparison,
 * merge suggestions and semantic drift.
 *
 * <p>Word-set cosine is used for text similarity, keyword Jaccard for profile similarity.
 * Only branches that have a semantic profile take part.</p>
 */
public final class BranchAnalytics {
    private static final Logger log = LogManager.getLogger(BranchAnalytics.class);

    private static final int TOP_PAIRS = 5;
    private static final int TOP_DISTINCT = 3;
    private static final int MIN_THOUGHTS_FOR_DRIFT = 3;
    private static final double STRONG_DRIFT = 0.7;

    private final BranchGraph graph;
    private final TermExtractor terms;
    private final EngineConfig.Branch cfg;

    public BranchAnalytics(BranchGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.terms = graph.terms();
        this.cfg = graph.config().branch;
    }

    // ----------------------------- profiles -----------------------------

    public ProfileComparison compareProfiles() {
        List<Branch> profiled = profiledBranches();
        List<Pair> pairs = new ArrayList<>();

        for (int i = 0; i < profiled.size(); i++) {
            for (int j = i + 1; j < profiled.size(); j++) {
                Branch a = profiled.get(i), b = profiled.get(j);
                Set<String> ka = keywords(a), kb = keywords(b);
                List<String> shared = ka.stream().filter(kb::contains).toList();
                pairs.add(new Pair(a.id, b.id, TermExtractor.jaccard(ka, kb), shared));
            }
        }

        List<Pair> mostSimilar = pairs.stream()
                .sorted(Comparator.comparingDouble((Pair p) -> -p.similarity).thenComparing(p -> p.branch1).thenComparing(p -> p.branch2))
                .limit(TOP_PAIRS)
                .toList();

        Map<String, double[]> sums = new HashMap<>();
        for (Pair p : pairs) {
            sums.computeIfAbsent(p.branch1, k -> new double[2]);
            sums.computeIfAbsent(p.branch2, k -> new double[2]);
            sums.get(p.branch1)[0] += p.similarity;
            sums.get(p.branch1)[1]++;
            sums.get(p.branch2)[0] += p.similarity;
            sums.get(p.branch2)[1]++;
        }
        List<String> mostDistinct = sums.entrySet().stream()
                .sorted(Comparator.comparingDouble((Map.Entry<String, double[]> e) -> e.getValue()[0] / e.getValue()[1])
                        .thenComparing(Map.Entry::getKey))
                .limit(TOP_DISTINCT)
                .map(Map.Entry::getKey)
                .toList();

        return new ProfileComparison(pairs, mostSimilar, mostDistinct);
    }

    // ----------------------------- merges -----------------------------

    public List<MergeSuggestion> suggestMerges() {
        return suggestMerges(cfg.mergeThreshold);
    }

    /**
     * Branch pairs whose joined text is more similar than {@code threshold}, most similar first.
     */
    public List<MergeSuggestion> suggestMerges(double threshold) {
        List<Branch> profiled = profiledBranches();
        Map<String, Set<String>> words = new HashMap<>();
        for (Branch b : profiled) words.put(b.id, terms.words(joinedText(b)));

        List<MergeSuggestion> out = new ArrayList<>();
        for (int i = 0; i < profiled.size(); i++) {
            for (int j = i + 1; j < profiled.size(); j++) {
                Branch a = profiled.get(i), b = profiled.get(j);
                double sim = TermExtractor.setCosine(words.get(a.id), words.get(b.id));
                if (sim <= threshold) continue;

                Set<String> ka = keywords(a);
                long shared = keywords(b).stream().filter(ka::contains).count();
                out.add(new MergeSuggestion(List.of(a.id, b.id), sim,
                        String.format(Locale.ROOT, "High semantic similarity (%.1f%%)", sim * 100.0),
                        "Combine " + (a.size() + b.size()) + " thoughts with " + shared + " shared concepts"));
            }
        }
        out.sort(Comparator.comparingDouble((MergeSuggestion m) -> -m.similarity));
        if (!out.isEmpty()) log.debug("{} merge suggestion(s) above {}", out.size(), threshold);
        return out;
    }

    // ----------------------------- drift -----------------------------

    public List<DriftReport> detectDrift() {
        return detectDrift(cfg.driftThreshold);
    }

    /**
     * Mean dissimilarity between the first and the last {@code branch.driftSampleSize} thoughts of
     * every profiled branch with at least three thoughts. Reports scores above {@code threshold}, highest first.
     */
    public List<DriftReport> detectDrift(double threshold) {
        List<DriftReport> out = new ArrayList<>();
        for (Branch b : profiledBranches()) {
            if (b.size() < MIN_THOUGHTS_FOR_DRIFT) continue;
            double score = driftScore(b);
            if (score > threshold) out.add(report(b.id, score, threshold));
        }
        out.sort(Comparator.comparingDouble((DriftReport d) -> -d.driftScore));
        return out;
    }

    double driftScore(Branch b) {
        int k = cfg.driftSampleSize;
        List<Thought> all = graph.getBranchThoughts(b.id);
        List<Thought> early = all.subList(0, Math.min(k, all.size()));
        List<Thought> recent = all.subList(Math.max(0, all.size() - k), all.size());

        double total = 0.0;
        int n = 0;
        for (Thought r : recent) {
            Set<String> wr = terms.words(r.content);
            for (Thought e : early) {
                total += 1.0 - TermExtractor.setCosine(wr, terms.words(e.content));
                n++;
            }
        }
        return n == 0 ? 0.0 : total / n;
    }

    private static DriftReport report(String branchId, double score, double threshold) {
        String reason, recommendation;
        if (score > STRONG_DRIFT) {
            reason = "Recent thoughts significantly diverge from initial direction";
            recommendation = "Consider splitting into separate branches";
        } else if (score > threshold) {
            reason = "Moderate drift from original focus";
            recommendation = "Review branch focus and realign if needed";
        } else {
            reason = "Minor drift detected";
            recommendation = "Continue with current direction";
        }
        return new DriftReport(branchId, score, reason, recommendation);
    }

    // ----------------------------- internals -----------------------------

    private List<Branch> profiledBranches() {
        return graph.getAllBranches().stream()
                .filter(b -> b.semanticProfile().isPresent())
                .collect(Collectors.toList());
    }

    private static Set<String> keywords(Branch b) {
        return b.semanticProfile().map(p -> (Set<String>) new LinkedHashSet<>(p.keywords)).orElse(Set.of());
    }

    private String joinedText(Branch b) {
        return graph.getBranchThoughts(b.id).stream().map(t -> t.content).collect(Collectors.joining(" "));
    }

    // ----------------------------- results -----------------------------

    public static final class Pair {
        public final String branch1;
        public final String branch2;
        public final double similarity;
        public final List<String> sharedConcepts;

        public Pair(String branch1, String branch2, double similarity, List<String> sharedConcepts) {
            this.branch1 = branch1;
            this.branch2 = branch2;
            this.similarity = similarity;
            this.sharedConcepts = List.copyOf(sharedConcepts);
        }
    }

    public static final class ProfileComparison {
        public final List<Pair> comparisons;
        public final List<Pair> mostSimilarPairs;
        public final List<String> mostDistinctBranches;

        public ProfileComparison(List<Pair> comparisons, List<Pair> mostSimilarPairs, List<String> mostDistinctBranches) {
            this.comparisons = List.copyOf(comparisons);
            this.mostSimilarPairs = List.copyOf(mostSimilarPairs);
            this.mostDistinctBranches = List.copyOf(mostDistinctBranches);
        }
    }

    public static final class MergeSuggestion {
        public final List<String> branches;
        public final double similarity;
        public final String reason;
        public final String potentialBenefit;

        public MergeSuggestion(List<String> branches, double similarity, String reason, String potentialBenefit) {
            this.branches = List.copyOf(branches);
            this.similarity = similarity;
            this.reason = reason;
            this.potentialBenefit = potentialBenefit;
        }
    }

    public static final class DriftReport {
        public final String branchId;
        public final double driftScore;
        public final String reason;
        public final String recommendation;

        public DriftReport(String branchId, double driftScore, String reason, String recommendation) {
            this.branchId = branchId;
            this.driftScore = driftScore;
            this.reason = reason;
            this.recommendation = recommendation;
        }
    }
}
