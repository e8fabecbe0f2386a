package org.calista.branchgraph.text;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TF-IDF keywords over a small document set (one branch worth of thoughts).
 * IDF is smoothed as ln(1 + N/df).
 * Tie-break: score desc, then term asc.
 */
public final class KeywordExtractor {

    private final TermExtractor terms;

    public KeywordExtractor(TermExtractor terms) {
        this.terms = Objects.requireNonNull(terms, "terms");
    }

    public List<String> extract(List<String> documents, int topN) {
        if (documents == null || documents.isEmpty() || topN <= 0) return List.of();

        List<List<String>> tokenized = new ArrayList<>(documents.size());
        Map<String, Integer> df = new HashMap<>();
        for (String doc : documents) {
            List<String> toks = terms.termList(doc).stream()
                    .filter(t -> !isNumeric(t))
                    .toList();
            tokenized.add(toks);
            for (String t : new HashSet<>(toks)) df.merge(t, 1, Integer::sum);
        }

        int n = tokenized.size();
        Map<String, Double> score = new HashMap<>();
        for (List<String> toks : tokenized) {
            if (toks.isEmpty()) continue;
            Map<String, Integer> tf = new HashMap<>();
            for (String t : toks) tf.merge(t, 1, Integer::sum);
            for (Map.Entry<String, Integer> e : tf.entrySet()) {
                double idf = Math.log(1.0 + (double) n / df.get(e.getKey()));
                score.merge(e.getKey(), (e.getValue() / (double) toks.size()) * idf, Double::sum);
            }
        }

        return score.entrySet().stream()
                .sorted((a, b) -> {
                    int c = Double.compare(b.getValue(), a.getValue());
                    return c != 0 ? c : a.getKey().compareTo(b.getKey());
                })
                .limit(topN)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static boolean isNumeric(String t) {
        for (int i = 0; i < t.length(); i++) {
            if (!Character.isDigit(t.charAt(i))) return false;
        }
        return true;
    }
}
