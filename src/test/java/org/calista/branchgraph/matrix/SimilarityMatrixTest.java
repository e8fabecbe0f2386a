package org.calista.branchgraph.matrix;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimilarityMatrixTest {

    @Test
    void writesAreSymmetric() {
        SimilarityMatrix m = new SimilarityMatrix(0.3, 4);
        m.set("a", "b", 0.7);
        assertEquals(0.7, m.get("a", "b"));
        assertEquals(0.7, m.get("b", "a"));
    }

    @Test
    void registrationIsIdempotentAndGrowsCapacity() {
        SimilarityMatrix m = new SimilarityMatrix(0.0, 2);
        int a = m.register("a");
        assertEquals(a, m.register("a"));

        m.set("a", "b", 0.9);
        for (int i = 0; i < 20; i++) m.register("t" + i);
        assertEquals(22, m.size());
        assertEquals(0.9, m.get("a", "b"), "entries survive growth");
        assertTrue(m.isRegistered("t19"));
    }

    @Test
    void lookupSeparatesNeverComputedFromBelowThreshold() {
        SimilarityMatrix m = new SimilarityMatrix(0.3, 4);
        m.register("a");
        m.register("b");
        m.register("c");

        assertEquals(OptionalDouble.empty(), m.lookup("a", "b"));

        m.set("a", "b", 0.1);
        assertEquals(OptionalDouble.of(0.0), m.lookup("a", "b"));
        assertEquals(OptionalDouble.of(0.0), m.lookup("b", "a"));
        assertEquals(0.0, m.get("a", "b"));

        m.set("a", "c", 0.6);
        assertEquals(OptionalDouble.of(0.6), m.lookup("c", "a"));
        assertEquals(OptionalDouble.empty(), m.lookup("a", "unknown"));
    }

    @Test
    void mostSimilarOrdersByScoreThenId() {
        SimilarityMatrix m = new SimilarityMatrix(0.3, 8);
        m.set("x", "b", 0.5);
        m.set("x", "a", 0.5);
        m.set("x", "c", 0.9);
        m.set("x", "d", 0.2);

        List<Scored<String>> top = m.mostSimilar("x", 3);
        assertEquals(List.of("c", "a", "b"), top.stream().map(s -> s.item).toList());
        assertEquals(List.of(), m.mostSimilar("missing", 3));
        assertEquals(1, m.mostSimilar("x", 1).size());
    }

    @Test
    void clustersAreConnectedComponentsAboveMinimum() {
        SimilarityMatrix m = new SimilarityMatrix(0.3, 8);
        m.set("a", "b", 0.8);
        m.set("b", "c", 0.6);
        m.set("d", "e", 0.9);
        m.set("c", "d", 0.4);
        m.register("lonely");

        List<List<String>> clusters = m.clusters(0.5);
        assertEquals(List.of(List.of("a", "b", "c"), List.of("d", "e")), clusters);

        List<List<String>> loose = m.clusters(0.3);
        assertEquals(1, loose.size());
        assertEquals(5, loose.get(0).size());
        assertFalse(loose.get(0).contains("lonely"));
    }

    @Test
    void statsCountThoughtsAndConnections() {
        SimilarityMatrix m = new SimilarityMatrix(0.3, 4);
        m.set("a", "b", 0.8);
        m.register("c");
        SimilarityMatrix.Stats s = m.stats();
        assertEquals(3, s.numThoughts);
        assertEquals(2, s.matrix.nonZero);
        assertEquals(2.0 / 3.0, s.avgConnections, 1e-9);
    }
}
