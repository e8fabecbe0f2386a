package org.calista.branchgraph.matrix;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Symmetric thought-to-thought similarity over a {@link SparseMatrix}.
 *
 * <p>Ids are registered once and get a stable dense index; the backing matrix doubles
 * its capacity when an index falls outside it. Every {@link #set} writes both (a,b) and (b,a).
 * Pairs that were computed but fell under the threshold are remembered, so {@link #lookup}
 * can tell "never computed" apart from "computed as ~0".</p>
 *
 * <p>Not thread-safe; the owning store serializes writes.</p>
 */
public final class SimilarityMatrix {
    private static final Logger log = LogManager.getLogger(SimilarityMatrix.class);

    private final double threshold;
    private final Map<String, Integer> idToIndex = new HashMap<>();
    private final List<String> indexToId = new ArrayList<>();
    private final Set<Long> computed = new HashSet<>();
    private SparseMatrix matrix;

    public SimilarityMatrix(double threshold, int initialSize) {
        this.threshold = threshold;
        int n = Math.max(1, initialSize);
        this.matrix = new SparseMatrix(n, n, threshold);
    }

    // ----------------------------- registry -----------------------------

    /**
     * Idempotent. Returns the dense index of {@code id}.
     */
    public int register(String id) {
        Objects.requireNonNull(id, "id");
        Integer existing = idToIndex.get(id);
        if (existing != null) return existing;

        int idx = indexToId.size();
        idToIndex.put(id, idx);
        indexToId.add(id);

        if (idx >= matrix.rows()) {
            int grown = Math.max(matrix.rows() * 2, idx + 1);
            log.debug("Growing similarity matrix {} -> {}", matrix.rows(), grown);
            matrix = matrix.resized(grown, grown);
        }
        return idx;
    }

    public boolean isRegistered(String id) {
        return id != null && idToIndex.containsKey(id);
    }

    public int size() {
        return indexToId.size();
    }

    // ----------------------------- values -----------------------------

    /**
     * Symmetric write; registers unknown ids.
     */
    public void set(String a, String b, double value) {
        int i = register(a);
        int j = register(b);
        matrix.set(i, j, value);
        matrix.set(j, i, value);
        computed.add(pairKey(i, j));
    }

    /** 0 when either id is unknown or the pair is absent. */
    public double get(String a, String b) {
        Integer i = idToIndex.get(a);
        Integer j = idToIndex.get(b);
        if (i == null || j == null) return 0.0;
        return matrix.get(i, j);
    }

    /**
     * Empty when the pair was never written; {@code 0.0} when written below the threshold.
     */
    public OptionalDouble lookup(String a, String b) {
        Integer i = idToIndex.get(a);
        Integer j = idToIndex.get(b);
        if (i == null || j == null) return OptionalDouble.empty();
        if (!computed.contains(pairKey(i, j))) return OptionalDouble.empty();
        OptionalDouble v = matrix.find(i, j);
        return v.isPresent() ? v : OptionalDouble.of(0.0);
    }

    /**
     * Top-K strictly positive neighbours of {@code id}, self excluded, score desc then id asc.
     */
    public List<Scored<String>> mostSimilar(String id, int k) {
        Integer i = idToIndex.get(id);
        if (i == null || k <= 0) return List.of();

        List<Scored<String>> out = new ArrayList<>();
        for (Map.Entry<Integer, Double> e : matrix.row(i).entrySet()) {
            int j = e.getKey();
            double v = e.getValue();
            if (j == i || !(v > 0.0)) continue;
            out.add(Scored.of(indexToId.get(j), v));
        }
        out.sort(null);
        return out.size() > k ? List.copyOf(out.subList(0, k)) : List.copyOf(out);
    }

    /**
     * Connected components of the graph with edges {@code sim >= minSimilarity}, found depth-first
     * in registration order. Singletons are omitted. Ids inside a cluster are in discovery order.
     */
    public List<List<String>> clusters(double minSimilarity) {
        int n = indexToId.size();
        boolean[] visited = new boolean[n];
        List<List<String>> out = new ArrayList<>();

        for (int start = 0; start < n; start++) {
            if (visited[start]) continue;

            List<String> cluster = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                int cur = stack.pop();
                if (visited[cur]) continue;
                visited[cur] = true;
                cluster.add(indexToId.get(cur));

                List<Integer> next = new ArrayList<>();
                for (Map.Entry<Integer, Double> e : matrix.row(cur).entrySet()) {
                    int j = e.getKey();
                    if (j < n && !visited[j] && e.getValue() >= minSimilarity) next.add(j);
                }
                // push in reverse so the smallest index is explored first
                next.sort((x, y) -> Integer.compare(y, x));
                for (int j : next) stack.push(j);
            }

            if (cluster.size() > 1) out.add(List.copyOf(cluster));
        }
        return out;
    }

    public Stats stats() {
        SparseMatrix.Stats base = matrix.stats();
        int numThoughts = indexToId.size();
        double avgConnections = numThoughts == 0 ? 0.0 : (double) base.nonZero / numThoughts;
        return new Stats(base, numThoughts, avgConnections);
    }

    public double threshold() {
        return threshold;
    }

    private static long pairKey(int i, int j) {
        int lo = Math.min(i, j), hi = Math.max(i, j);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }

    public static final class Stats {
        public final SparseMatrix.Stats matrix;
        public final int numThoughts;
        public final double avgConnections;

        public Stats(SparseMatrix.Stats matrix, int numThoughts, double avgConnections) {
            this.matrix = matrix;
            this.numThoughts = numThoughts;
            this.avgConnections = avgConnections;
        }
    }
}
