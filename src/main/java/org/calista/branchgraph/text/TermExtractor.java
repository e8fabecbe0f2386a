package org.calista.branchgraph.text;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Content terms of a text: tokens longer than two characters that are not stop words.
 * Used by the evaluator heuristics, the hashing embedder and the word-set similarity.
 */
public final class TermExtractor {

    private static final int MIN_TERM_LENGTH = 3;

    private final Tokenizer tokenizer;
    private final Set<String> stopWords;

    public TermExtractor(Tokenizer tokenizer, Collection<String> stopWords) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        Set<String> sw = new LinkedHashSet<>();
        if (stopWords != null) {
            for (String w : stopWords) {
                if (w != null && !w.isBlank()) sw.add(w.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.stopWords = Set.copyOf(sw);
    }

    /** Terms in first-occurrence order, duplicates kept. */
    public List<String> termList(String text) {
        List<String> tokens = tokenizer.tokenize(text);
        return tokens.stream()
                .filter(t -> t.length() >= MIN_TERM_LENGTH)
                .filter(t -> !stopWords.contains(t))
                .toList();
    }

    /** Distinct terms in first-occurrence order. */
    public Set<String> terms(String text) {
        return new LinkedHashSet<>(termList(text));
    }

    /** Distinct tokens, no filtering at all. */
    public Set<String> words(String text) {
        return new LinkedHashSet<>(tokenizer.tokenize(text));
    }

    public boolean isStopWord(String word) {
        return word != null && stopWords.contains(word);
    }

    /**
     * Set cosine: |a ∩ b| / sqrt(|a|·|b|). Zero when either side is empty.
     */
    public static double setCosine(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> small = a.size() <= b.size() ? a : b;
        Set<String> large = small == a ? b : a;
        int inter = 0;
        for (String s : small) if (large.contains(s)) inter++;
        return inter / Math.sqrt((double) a.size() * b.size());
    }

    /**
     * Jaccard: |a ∩ b| / |a ∪ b|. Zero when both are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null) return 0.0;
        if (a.isEmpty() && b.isEmpty()) return 0.0;
        int inter = 0;
        for (String s : a) if (b.contains(s)) inter++;
        int union = a.size() + b.size() - inter;
        return union == 0 ? 0.0 : (double) inter / union;
    }
}
