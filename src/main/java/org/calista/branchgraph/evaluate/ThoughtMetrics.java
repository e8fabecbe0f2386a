package org.calista.branchgraph.evaluate;

import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.embed.EmbeddingGateway;
import org.calista.branchgraph.embed.Vectors;
import org.calista.branchgraph.graph.Thought;
import org.calista.branchgraph.text.TermExtractor;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Per-thought metric heuristics over a backward window of preceding thoughts.
 *
 * <p>Similarity between two thoughts is the clamped embedding cosine, kept in a bounded LRU keyed
 * by the unordered id pair. Embedding failures propagate as
 * {@link org.calista.branchgraph.error.ProviderException}.</p>
 */
final class ThoughtMetrics {

    private final EmbeddingGateway embeddings;
    private final TermExtractor terms;
    private final Pattern negation;
    private final int minSharedTerms;
    private final double redundancyThreshold;
    private final Map<String, Double> similarityCache;

    ThoughtMetrics(EmbeddingGateway embeddings, TermExtractor terms, EngineConfig.Evaluation cfg) {
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
        this.terms = Objects.requireNonNull(terms, "terms");
        this.negation = negationPattern(cfg.negationTerms);
        this.minSharedTerms = cfg.minSharedTerms;
        this.redundancyThreshold = cfg.thresholds.similarity;

        final int cap = cfg.similarityCacheSize;
        this.similarityCache = new LinkedHashMap<>(Math.min(cap, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Double> eldest) {
                return size() > cap;
            }
        };
    }

    static Pattern negationPattern(List<String> negationTerms) {
        String alt = negationTerms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> Pattern.quote(t.trim()))
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alt + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    // ----------------------------- window metrics -----------------------------

    /** One delta per newly folded thought. */
    static final class Delta {
        final double coherence;
        final double contradiction;
        final double informationGain;
        final double redundancy;

        Delta(double coherence, double contradiction, double informationGain, double redundancy) {
            this.coherence = coherence;
            this.contradiction = contradiction;
            this.informationGain = informationGain;
            this.redundancy = redundancy;
        }
    }

    Delta delta(Thought t, List<Thought> window) {
        if (window.isEmpty()) {
            return new Delta(1.0, 0.0, informationGain(t, window), 0.0);
        }

        double simSum = 0.0;
        boolean redundant = false;
        int contradictions = 0;
        for (Thought w : window) {
            double s = similarity(t, w);
            simSum += s;
            if (s > redundancyThreshold) redundant = true;
            if (contradicts(t.content, w.content)) contradictions++;
        }

        return new Delta(
                simSum / window.size(),
                (double) contradictions / window.size(),
                informationGain(t, window),
                redundant ? 1.0 : 0.0);
    }

    /**
     * A negation marker in exactly one of the texts, plus enough shared content terms.
     */
    boolean contradicts(String a, String b) {
        boolean na = negation.matcher(a).find();
        boolean nb = negation.matcher(b).find();
        if (na == nb) return false;

        Set<String> ta = terms.terms(a);
        int shared = 0;
        for (String s : terms.terms(b)) {
            if (ta.contains(s) && ++shared >= minSharedTerms) return true;
        }
        return false;
    }

    double informationGain(Thought t, List<Thought> window) {
        Set<String> fresh = terms.terms(t.content);
        if (fresh.isEmpty()) return 1.0;

        Set<String> seen = new HashSet<>();
        for (Thought w : window) seen.addAll(terms.termList(w.content));

        int unseen = 0;
        for (String s : fresh) if (!seen.contains(s)) unseen++;
        return (double) unseen / fresh.size();
    }

    double similarity(Thought a, Thought b) {
        String key = a.id.compareTo(b.id) <= 0 ? a.id + '|' + b.id : b.id + '|' + a.id;
        synchronized (similarityCache) {
            Double hit = similarityCache.get(key);
            if (hit != null) return hit;
        }
        double s = Vectors.clamp01(embeddings.similarity(a.content, b.content));
        synchronized (similarityCache) {
            similarityCache.put(key, s);
        }
        return s;
    }

    // ----------------------------- branch metrics -----------------------------

    /**
     * Least-squares slope of the last {@code window} confidences, mapped from [-1,1] to [0,1].
     * 0.5 with fewer than two thoughts.
     */
    static double confidenceGradient(List<Thought> thoughts, int window) {
        int from = Math.max(0, thoughts.size() - window);
        int n = thoughts.size() - from;
        if (n < 2) return 0.5;

        double meanX = (n - 1) / 2.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) meanY += thoughts.get(from + i).confidence;
        meanY /= n;

        double num = 0.0, den = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            num += dx * (thoughts.get(from + i).confidence - meanY);
            den += dx * dx;
        }
        double slope = num / den;
        return Vectors.clamp01((slope + 1.0) / 2.0);
    }

    /**
     * Share of goal terms that appear in the last {@code window} thoughts. 0 when the goal has no terms.
     */
    double termGoalAlignment(String goal, List<Thought> thoughts, int window) {
        Set<String> goalTerms = terms.terms(goal);
        if (goalTerms.isEmpty()) return 0.0;

        Set<String> branchTerms = new HashSet<>();
        for (Thought t : thoughts.subList(Math.max(0, thoughts.size() - window), thoughts.size())) {
            branchTerms.addAll(terms.termList(t.content));
        }
        int hit = 0;
        for (String g : goalTerms) if (branchTerms.contains(g)) hit++;
        return (double) hit / goalTerms.size();
    }

    double embeddingGoalAlignment(String goal, float[] branchCenter) {
        return Vectors.clamp01(embeddings.cosine(embeddings.embed(goal), branchCenter));
    }

    void clear() {
        synchronized (similarityCache) {
            similarityCache.clear();
        }
    }
}
