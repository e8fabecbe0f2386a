package org.calista.branchgraph.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TermExtractorTest {

    private final TermExtractor terms = new TermExtractor(SimpleTokenizer.INSTANCE, List.of("the", "are", "and"));

    @Test
    void dropsShortTokensAndStopWords() {
        assertEquals(List.of("cats", "not", "mammals", "cats"), terms.termList("The cats are NOT mammals, cats!"));
        assertEquals(Set.of("cats", "not", "mammals"), terms.terms("The cats are NOT mammals, cats!"));
        assertTrue(terms.isStopWord("the"));
        assertFalse(terms.isStopWord("cats"));
    }

    @Test
    void wordsKeepEverythingDistinct() {
        assertEquals(Set.of("a", "cat", "is", "the"), terms.words("A cat is the cat"));
    }

    @Test
    void setCosineMatchesDefinition() {
        Set<String> a = Set.of("x", "y", "z", "w");
        Set<String> b = Set.of("x", "y");
        assertEquals(2 / Math.sqrt(8), TermExtractor.setCosine(a, b), 1e-12);
        assertEquals(0.0, TermExtractor.setCosine(a, Set.of()));
    }

    @Test
    void jaccardMatchesDefinition() {
        assertEquals(1.0 / 3.0, TermExtractor.jaccard(Set.of("a", "b"), Set.of("b", "c")), 1e-12);
        assertEquals(0.0, TermExtractor.jaccard(Set.of(), Set.of()));
    }

    @Test
    void keywordsRankByTfIdfThenAlphabetically() {
        KeywordExtractor kx = new KeywordExtractor(terms);
        List<String> top = kx.extract(List.of(
                "mice mice mice hunt 2024",
                "sleep often"), 3);

        assertEquals(List.of("mice", "often", "sleep"), top);
        assertEquals(List.of(), kx.extract(List.of(), 5));
        assertEquals(List.of(), kx.extract(List.of("cats"), 0));
    }
}
