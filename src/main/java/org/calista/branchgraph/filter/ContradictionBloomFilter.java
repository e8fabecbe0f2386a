package org.calista.branchgraph.filter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.core.EngineConfig;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fast probabilistic contradiction pre-filter.
 *
 * <p>Remembers which concepts were asserted in a positive and in a negative voice, and which
 * significant words appeared next to each other. A new text is suspicious when it negates a concept
 * seen positively (or the reverse), or when two neighbouring words come in the reverse order of an
 * earlier text.</p>
 *
 * <p>Thread-safe: {@link #checkAndAdd} is atomic.</p>
 */
public final class ContradictionBloomFilter {
    private static final Logger log = LogManager.getLogger(ContradictionBloomFilter.class);

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NEGATIVE = Pattern.compile("\\b(not|no|never|cannot|won't|shouldn't)\\b");
    private static final Pattern POSITIVE = Pattern.compile("\\b(is|are|can|will|should|must)\\b");

    private final BloomFilter positiveAssertions;
    private final BloomFilter negativeAssertions;
    private final BloomFilter conceptPairs;
    private final int minWordLength;

    public ContradictionBloomFilter(EngineConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        EngineConfig.BloomFilters bf = cfg.bloomFilter;
        this.positiveAssertions = new BloomFilter(bf.positive.expectedElements, bf.positive.falsePositiveRate);
        this.negativeAssertions = new BloomFilter(bf.negative.expectedElements, bf.negative.falsePositiveRate);
        this.conceptPairs = new BloomFilter(bf.conceptPairs.expectedElements, bf.conceptPairs.falsePositiveRate);
        this.minWordLength = cfg.text.minWordLength;
    }

    /**
     * Checks {@code text} against everything seen so far, then records it.
     */
    public synchronized ContradictionCheck checkAndAdd(String text) {
        Objects.requireNonNull(text, "text");
        List<String> words = significantWords(text);
        List<String> concepts = concepts(words);
        String lower = text.toLowerCase(Locale.ROOT);
        boolean negative = NEGATIVE.matcher(lower).find();
        boolean positive = POSITIVE.matcher(lower).find();

        EnumSet<ContradictionType> found = EnumSet.noneOf(ContradictionType.class);
        for (String c : concepts) {
            if (negative && positiveAssertions.contains(c)) found.add(ContradictionType.NEGATION);
            if (positive && negativeAssertions.contains(c)) found.add(ContradictionType.AFFIRMATION);
        }
        for (int i = 0; i + 1 < words.size(); i++) {
            if (conceptPairs.contains(pairKey(words.get(i + 1), words.get(i)))) {
                found.add(ContradictionType.RELATIONAL);
                break;
            }
        }

        for (String c : concepts) {
            if (negative) negativeAssertions.add(c);
            if (positive) positiveAssertions.add(c);
        }
        for (int i = 0; i + 1 < words.size(); i++) {
            conceptPairs.add(pairKey(words.get(i), words.get(i + 1)));
        }

        if (!found.isEmpty() && log.isDebugEnabled()) {
            log.debug("Potential contradiction {} in: {}", found, abbreviate(text));
        }
        return found.isEmpty() ? ContradictionCheck.none() : new ContradictionCheck(true, new ArrayList<>(found));
    }

    /**
     * Words longer than the configured minimum, followed by their adjacent bigrams {@code a_b},
     * de-duplicated in first-occurrence order.
     */
    public List<String> extractConcepts(String text) {
        return concepts(significantWords(text));
    }

    /** Ordered pairs are built from these, so a reversal is visible as two swapped neighbours. */
    private List<String> significantWords(String text) {
        if (text == null || text.isBlank()) return List.of();
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) return List.of();

        List<String> words = new ArrayList<>();
        for (String w : WHITESPACE.split(cleaned)) {
            if (w.length() > minWordLength) words.add(w);
        }
        return words;
    }

    private static List<String> concepts(List<String> words) {
        Set<String> out = new LinkedHashSet<>();
        for (int i = 0; i < words.size(); i++) {
            out.add(words.get(i));
            if (i + 1 < words.size()) out.add(words.get(i) + "_" + words.get(i + 1));
        }
        return new ArrayList<>(out);
    }

    public synchronized void clear() {
        positiveAssertions.clear();
        negativeAssertions.clear();
        conceptPairs.clear();
    }

    public synchronized Stats stats() {
        return new Stats(positiveAssertions.stats(), negativeAssertions.stats(), conceptPairs.stats());
    }

    private static String pairKey(String a, String b) {
        return a + "|" + b;
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }

    public static final class Stats {
        public final BloomFilter.Stats positiveAssertions;
        public final BloomFilter.Stats negativeAssertions;
        public final BloomFilter.Stats conceptPairs;

        public Stats(BloomFilter.Stats positiveAssertions, BloomFilter.Stats negativeAssertions, BloomFilter.Stats conceptPairs) {
            this.positiveAssertions = positiveAssertions;
            this.negativeAssertions = negativeAssertions;
            this.conceptPairs = conceptPairs;
        }
    }
}
