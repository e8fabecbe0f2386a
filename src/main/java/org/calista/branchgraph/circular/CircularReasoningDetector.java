package org.calista.branchgraph.circular;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.text.LogicalComponents;
import org.calista.branchgraph.text.TermExtractor;
import org.calista.branchgraph.text.TextAnalyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CircularReasoningDetector: граф зависимостей между мыслями и поиск циклов в нём.
 *
 * <p>Each tracked thought contributes its premises, conclusions and outgoing dependencies
 * (explicit references in the text plus caller-supplied references). Only edges that point at a
 * currently tracked thought take part in cycle search.</p>
 *
 * <p>Capacity-bounded: once {@code circular.maxTrackedThoughts} is reached the oldest tracked
 * thought is evicted from every map. Cycles through evicted thoughts are no longer reported.</p>
 *
 * <p>All public methods are synchronized.</p>
 */
public final class CircularReasoningDetector {
    private static final Logger log = LogManager.getLogger(CircularReasoningDetector.class);

    private static final double DIRECT_CONFIDENCE = 1.0;
    private static final double PREMISE_CONFIDENCE = 0.8;
    private static final double INDIRECT_CONFIDENCE = 0.7;
    private static final int SIGNIFICANT_WORD_LENGTH = 3;

    private final TextAnalyzer analyzer;
    private final int capacity;
    private final int indirectMinPathNodes;
    private final double premiseSimilarity;

    /** Insertion order = eviction order. */
    private final LinkedHashMap<String, Tracked> thoughts = new LinkedHashMap<>();
    private final Map<String, Set<String>> premiseMap = new LinkedHashMap<>();
    private final Map<String, Set<String>> conclusionMap = new LinkedHashMap<>();
    private long evictions;

    public CircularReasoningDetector(TextAnalyzer analyzer, EngineConfig cfg) {
        this(analyzer, cfg.circular.maxTrackedThoughts, cfg.circular.indirectMinPathNodes, cfg.circular.premiseSimilarity);
    }

    public CircularReasoningDetector(TextAnalyzer analyzer, int capacity, int indirectMinPathNodes, double premiseSimilarity) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        if (capacity < 2) throw new IllegalArgumentException("capacity must be >= 2: " + capacity);
        this.capacity = capacity;
        this.indirectMinPathNodes = indirectMinPathNodes;
        this.premiseSimilarity = premiseSimilarity;
    }

    private static final class Tracked {
        final LogicalComponents components;
        final Set<String> dependencies;

        Tracked(LogicalComponents components, Set<String> dependencies) {
            this.components = components;
            this.dependencies = dependencies;
        }
    }

    // =========================
    // Ingest
    // =========================

    /**
     * Tracks a thought. Re-adding an id replaces its previous record.
     * Self references are ignored.
     */
    public synchronized void addThought(String thoughtId, String content, Collection<String> referencedIds) {
        Objects.requireNonNull(thoughtId, "thoughtId");
        LogicalComponents lc = analyzer.analyze(content == null ? "" : content);

        Set<String> deps = new LinkedHashSet<>(lc.dependencies);
        if (referencedIds != null) {
            for (String r : referencedIds) if (r != null && !r.isBlank()) deps.add(r);
        }
        deps.remove(thoughtId);

        if (thoughts.containsKey(thoughtId)) remove(thoughtId);
        while (thoughts.size() >= capacity) evictOldest();

        thoughts.put(thoughtId, new Tracked(lc, Collections.unmodifiableSet(deps)));
        for (String p : lc.premises) premiseMap.computeIfAbsent(p, k -> new LinkedHashSet<>()).add(thoughtId);
        for (String c : lc.conclusions) conclusionMap.computeIfAbsent(c, k -> new LinkedHashSet<>()).add(thoughtId);

        log.trace("Tracked thought {}: premises={}, conclusions={}, deps={}",
                thoughtId, lc.premises.size(), lc.conclusions.size(), deps.size());
    }

    public synchronized boolean isTracked(String thoughtId) {
        return thoughts.containsKey(thoughtId);
    }

    public synchronized int size() {
        return thoughts.size();
    }

    private void evictOldest() {
        Iterator<String> it = thoughts.keySet().iterator();
        if (!it.hasNext()) return;
        String oldest = it.next();
        remove(oldest);
        evictions++;
        log.debug("Evicted {} from dependency graph (capacity={})", oldest, capacity);
    }

    private void remove(String id) {
        Tracked t = thoughts.remove(id);
        if (t == null) return;
        unindex(premiseMap, t.components.premises, id);
        unindex(conclusionMap, t.components.conclusions, id);
    }

    private static void unindex(Map<String, Set<String>> map, List<String> keys, String id) {
        for (String k : keys) {
            Set<String> s = map.get(k);
            if (s == null) continue;
            s.remove(id);
            if (s.isEmpty()) map.remove(k);
        }
    }

    // =========================
    // Detection
    // =========================

    /** Direct, premise and indirect patterns, in that order. */
    public synchronized List<CircularPattern> detectAllPatterns() {
        List<CircularPattern> out = new ArrayList<>();
        out.addAll(detectDirectCircles());
        out.addAll(detectPremiseConclusionCircles());
        out.addAll(detectIndirectCircles());
        return out;
    }

    /**
     * Depth-first search from every tracked thought. The in-path set is cloned per branch of the
     * search, so every simple cycle reachable from a start is seen. Nodes fully explored from an
     * earlier start are not entered again: every cycle through them has already been reported.
     */
    public synchronized List<CircularPattern> detectDirectCircles() {
        List<CircularPattern> out = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        Set<String> exhausted = new HashSet<>();

        for (String start : thoughts.keySet()) {
            if (exhausted.contains(start)) continue;

            Set<String> reached = new HashSet<>();
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(start, new LinkedHashSet<>(List.of(start))));

            while (!stack.isEmpty()) {
                Frame f = stack.pop();
                reached.add(f.node);
                for (String dep : knownDependencies(f.node)) {
                    if (f.path.contains(dep)) {
                        List<String> cycle = cycleFrom(f.path, dep);
                        if (seen.add(canonical(cycle))) {
                            out.add(new CircularPattern(CycleKind.DIRECT, cycle, DIRECT_CONFIDENCE,
                                    "Direct circular dependency: " + String.join(" -> ", cycle) + " -> " + cycle.get(0)));
                        }
                    } else if (!exhausted.contains(dep)) {
                        LinkedHashSet<String> next = new LinkedHashSet<>(f.path);
                        next.add(dep);
                        stack.push(new Frame(dep, next));
                    }
                }
            }
            exhausted.addAll(reached);
        }
        return out;
    }

    private static final class Frame {
        final String node;
        final LinkedHashSet<String> path;

        Frame(String node, LinkedHashSet<String> path) {
            this.node = node;
            this.path = path;
        }
    }

    /**
     * Pairs where t2 concludes exactly a premise of t1 and some conclusion of t1 is lexically
     * close to some premise of t2 (Jaccard over words longer than three characters).
     */
    public synchronized List<CircularPattern> detectPremiseConclusionCircles() {
        List<CircularPattern> out = new ArrayList<>();
        Set<String> seenPairs = new HashSet<>();

        for (Map.Entry<String, Set<String>> e : premiseMap.entrySet()) {
            Set<String> concluders = conclusionMap.get(e.getKey());
            if (concluders == null || concluders.isEmpty()) continue;

            for (String t1 : e.getValue()) {
                for (String t2 : concluders) {
                    if (t1.equals(t2)) continue;
                    String pairKey = t1.compareTo(t2) < 0 ? t1 + "|" + t2 : t2 + "|" + t1;
                    if (seenPairs.contains(pairKey)) continue;

                    Tracked a = thoughts.get(t1);
                    Tracked b = thoughts.get(t2);
                    if (a == null || b == null) continue;
                    if (!anySimilar(a.components.conclusions, b.components.premises)) continue;

                    seenPairs.add(pairKey);
                    out.add(new CircularPattern(CycleKind.PREMISE, List.of(t1, t2), PREMISE_CONFIDENCE,
                            "Premise-conclusion circle: " + t1 + " assumes \"" + e.getKey() + "\" which " + t2
                                    + " concludes, and " + t2 + " assumes what " + t1 + " concludes"));
                }
            }
        }
        return out;
    }

    /**
     * Transitive closure by Floyd–Warshall over the thoughts that take part in at least one edge,
     * then a BFS per self-reachable node for the shortest cycle. Cycles short enough to be
     * reported as direct two-node loops are skipped.
     */
    public synchronized List<CircularPattern> detectIndirectCircles() {
        List<String> nodes = nodesWithEdges();
        int n = nodes.size();
        if (n == 0) return List.of();

        Map<String, Integer> index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) index.put(nodes.get(i), i);

        BitSet[] reach = new BitSet[n];
        for (int i = 0; i < n; i++) {
            reach[i] = new BitSet(n);
            for (String dep : knownDependencies(nodes.get(i))) {
                Integer j = index.get(dep);
                if (j != null) reach[i].set(j);
            }
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (reach[i].get(k)) reach[i].or(reach[k]);
            }
        }

        List<CircularPattern> out = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        for (int i = 0; i < n; i++) {
            if (!reach[i].get(i)) continue;
            List<String> path = shortestCycle(nodes.get(i));
            // path is closed: first == last
            if (path.size() <= indirectMinPathNodes) continue;

            List<String> cycle = path.subList(0, path.size() - 1);
            if (!seen.add(canonical(cycle))) continue;
            out.add(new CircularPattern(CycleKind.INDIRECT, cycle, INDIRECT_CONFIDENCE,
                    "Indirect circular reasoning through " + cycle.size() + " thoughts: " + String.join(" -> ", path)));
        }
        return out;
    }

    public synchronized Stats stats() {
        int withDeps = 0;
        long totalDeps = 0;
        for (String id : thoughts.keySet()) {
            int d = knownDependencies(id).size();
            if (d > 0) withDeps++;
            totalDeps += d;
        }
        double avg = thoughts.isEmpty() ? 0.0 : (double) totalDeps / thoughts.size();
        return new Stats(thoughts.size(), premiseMap.size(), conclusionMap.size(), withDeps, avg, evictions);
    }

    public synchronized void clear() {
        thoughts.clear();
        premiseMap.clear();
        conclusionMap.clear();
    }

    // =========================
    // Internals
    // =========================

    private List<String> knownDependencies(String id) {
        Tracked t = thoughts.get(id);
        if (t == null || t.dependencies.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(t.dependencies.size());
        for (String d : t.dependencies) if (thoughts.containsKey(d)) out.add(d);
        return out;
    }

    private List<String> nodesWithEdges() {
        Set<String> out = new LinkedHashSet<>();
        for (String id : thoughts.keySet()) {
            List<String> deps = knownDependencies(id);
            if (deps.isEmpty()) continue;
            out.add(id);
            out.addAll(deps);
        }
        return new ArrayList<>(out);
    }

    /** Closed path start → … → start, or empty if none. */
    private List<String> shortestCycle(String start) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String d : knownDependencies(start)) {
            if (d.equals(start)) return List.of(start, start);
            if (parent.putIfAbsent(d, start) == null) queue.add(d);
        }
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            for (String d : knownDependencies(cur)) {
                if (d.equals(start)) {
                    List<String> rev = new ArrayList<>();
                    rev.add(start);
                    for (String x = cur; x != null && !x.equals(start); x = parent.get(x)) rev.add(x);
                    rev.add(start);
                    Collections.reverse(rev);
                    return rev;
                }
                if (!parent.containsKey(d)) {
                    parent.put(d, cur);
                    queue.add(d);
                }
            }
        }
        return List.of();
    }

    private static List<String> cycleFrom(LinkedHashSet<String> path, String entry) {
        List<String> out = new ArrayList<>();
        boolean on = false;
        for (String p : path) {
            if (p.equals(entry)) on = true;
            if (on) out.add(p);
        }
        return out;
    }

    /** Rotation starting at the smallest id. */
    private static List<String> canonical(List<String> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(min)) < 0) min = i;
        }
        List<String> out = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) out.add(cycle.get((min + i) % cycle.size()));
        return out;
    }

    private boolean anySimilar(List<String> left, List<String> right) {
        for (String a : left) {
            Set<String> wa = significantWords(a);
            for (String b : right) {
                if (TermExtractor.jaccard(wa, significantWords(b)) > premiseSimilarity) return true;
            }
        }
        return false;
    }

    private static Set<String> significantWords(String s) {
        Set<String> out = new HashSet<>();
        for (String w : s.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (w.length() > SIGNIFICANT_WORD_LENGTH) out.add(w);
        }
        return out;
    }

    public static final class Stats {
        public final int totalThoughts;
        public final int totalPremises;
        public final int totalConclusions;
        public final int thoughtsWithDependencies;
        public final double averageDependencies;
        public final long evictions;

        public Stats(int totalThoughts, int totalPremises, int totalConclusions,
                     int thoughtsWithDependencies, double averageDependencies, long evictions) {
            this.totalThoughts = totalThoughts;
            this.totalPremises = totalPremises;
            this.totalConclusions = totalConclusions;
            this.thoughtsWithDependencies = thoughtsWithDependencies;
            this.averageDependencies = averageDependencies;
            this.evictions = evictions;
        }
    }
}
