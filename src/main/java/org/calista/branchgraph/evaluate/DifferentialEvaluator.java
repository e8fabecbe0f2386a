package org.calista.branchgraph.evaluate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.embed.EmbeddingGateway;
import org.calista.branchgraph.embed.EmbeddingProvider;
import org.calista.branchgraph.error.NotFoundException;
import org.calista.branchgraph.error.ProviderException;
import org.calista.branchgraph.events.EventKind;
import org.calista.branchgraph.events.GraphEvent;
import org.calista.branchgraph.graph.Branch;
import org.calista.branchgraph.graph.BranchGraph;
import org.calista.branchgraph.graph.SemanticProfile;
import org.calista.branchgraph.graph.Thought;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DifferentialEvaluator: инкрементальная оценка качества ветки.
 *
 * <p>
 * Each branch keeps its own event cursor and last result. A call reads only the events appended
 * since that cursor, turns every new THOUGHT_ADDED of the branch into a {@link ThoughtMetrics.Delta}
 * over a bounded window of its predecessors, and folds the deltas into the running means:
 * {@code new = old*(total-added)/total + sum(delta)/total}. Confidence gradient and goal alignment
 * are recomputed on every call.
 * </p>
 *
 * <p>
 * Concurrent calls for the same branch share one in-flight computation. When the embedding provider
 * fails or times out, the last cached result (or the neutral one) is returned marked stale, and
 * neither the cursor nor the cache moves.
 * </p>
 */
public final class DifferentialEvaluator {
    private static final Logger log = LogManager.getLogger(DifferentialEvaluator.class);

    private final BranchGraph graph;
    private final EngineConfig.Evaluation cfg;
    private final EngineConfig.Weights weights;
    private final EmbeddingGateway embeddings;
    private final ThoughtMetrics metrics;

    private final ConcurrentHashMap<String, Cached> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<EvaluationResult>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong lastProcessedEvent = new AtomicLong();
    private final AtomicLong generation = new AtomicLong();

    private volatile String goal;

    public DifferentialEvaluator(BranchGraph graph, EngineConfig cfg, EmbeddingProvider provider) {
        this.graph = Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(cfg, "cfg");
        this.cfg = cfg.evaluation;
        this.weights = cfg.evaluation.weights;
        this.embeddings = new EmbeddingGateway(Objects.requireNonNull(provider, "provider"),
                cfg.embedding.timeoutMs, cfg.embedding.cacheSize);
        this.metrics = new ThoughtMetrics(embeddings, graph.terms(), cfg.evaluation);
    }

    private static final class Cached {
        final long cursor;
        final EvaluationResult result;

        Cached(long cursor, EvaluationResult result) {
            this.cursor = cursor;
            this.result = result;
        }
    }

    // =========================
    // Public API
    // =========================

    /**
     * Folds in the branch's new thoughts since the last call.
     *
     * @throws NotFoundException unknown branch
     */
    public EvaluationResult evaluateIncremental(String branchId) {
        if (!graph.hasBranch(branchId)) throw NotFoundException.branch(branchId);

        CompletableFuture<EvaluationResult> mine = new CompletableFuture<>();
        CompletableFuture<EvaluationResult> running = inFlight.putIfAbsent(branchId, mine);
        if (running != null) {
            log.debug("Joining in-flight evaluation of {}", branchId);
            return await(running);
        }

        try {
            EvaluationResult r = computeIncremental(branchId);
            mine.complete(r);
            return r;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(branchId, mine);
        }
    }

    /**
     * Full pass over the branch from its first thought. Touches neither cache nor cursors.
     *
     * @throws NotFoundException unknown branch
     * @throws ProviderException embedding failure
     */
    public EvaluationResult recompute(String branchId) {
        if (!graph.hasBranch(branchId)) throw NotFoundException.branch(branchId);
        List<Thought> thoughts = graph.getBranchThoughts(branchId);

        Running acc = Running.empty();
        acc = fold(acc, deltasFor(thoughts));
        return finish(branchId, acc, thoughts);
    }

    /** Sets the goal and drops every cached result and cursor. A null or blank goal clears it. */
    public void setGoal(String goal) {
        this.goal = goal == null || goal.isBlank() ? null : goal.trim();
        generation.incrementAndGet();
        cache.clear();
        log.info("Evaluation goal {}", this.goal == null ? "cleared" : "set: " + this.goal);
    }

    public Optional<String> goal() {
        return Optional.ofNullable(goal);
    }

    public void clearCaches() {
        generation.incrementAndGet();
        cache.clear();
        metrics.clear();
        embeddings.clear();
        lastProcessedEvent.set(0);
    }

    /** Highest event cursor reached by any branch. Statistic only. */
    public long lastProcessedEvent() {
        return lastProcessedEvent.get();
    }

    // =========================
    // Incremental pass
    // =========================

    private EvaluationResult computeIncremental(String branchId) {
        final long gen = generation.get();
        final Cached prev = cache.get(branchId);
        final long cursor = prev == null ? 0 : prev.cursor;

        List<GraphEvent> events = graph.getEventsSince(cursor);
        long next = events.isEmpty() ? cursor : events.get(events.size() - 1).index + 1;

        List<Thought> added = new ArrayList<>();
        for (GraphEvent e : events) {
            if (e.kind == EventKind.THOUGHT_ADDED && branchId.equals(e.branchId)) {
                graph.getThought(e.thoughtId).ifPresent(added::add);
            }
        }

        if (added.isEmpty() && prev != null) {
            store(branchId, gen, new Cached(next, prev.result));
            lastProcessedEvent.accumulateAndGet(next, Math::max);
            return prev.result;
        }

        try {
            Running acc = prev == null ? Running.empty() : Running.of(prev.result);
            acc = fold(acc, deltasFor(added));

            List<Thought> thoughts = graph.getBranchThoughts(branchId);
            if (thoughts.size() > acc.count) thoughts = thoughts.subList(0, acc.count);

            EvaluationResult r = finish(branchId, acc, thoughts);
            store(branchId, gen, new Cached(next, r));
            lastProcessedEvent.accumulateAndGet(next, Math::max);

            if (log.isDebugEnabled()) log.debug("Evaluated {} (+{}): {}", branchId, added.size(), r.brief());
            return r;
        } catch (ProviderException e) {
            log.warn("Evaluation of {} served stale: {}", branchId, e.getMessage());
            return (prev == null ? EvaluationResult.neutral(weights) : prev.result).asStale();
        }
    }

    private void store(String branchId, long gen, Cached c) {
        // a goal change during the pass invalidates what was computed under the old goal
        if (generation.get() == gen) cache.put(branchId, c);
    }

    // =========================
    // Folding
    // =========================

    private static final class Running {
        final double coherence;
        final double contradiction;
        final double informationGain;
        final double redundancy;
        final int count;

        Running(double coherence, double contradiction, double informationGain, double redundancy, int count) {
            this.coherence = coherence;
            this.contradiction = contradiction;
            this.informationGain = informationGain;
            this.redundancy = redundancy;
            this.count = count;
        }

        static Running empty() {
            return new Running(1.0, 0.0, 1.0, 0.0, 0);
        }

        static Running of(EvaluationResult r) {
            return new Running(r.coherence, r.contradiction, r.informationGain, r.redundancy, r.thoughtCount);
        }
    }

    private List<ThoughtMetrics.Delta> deltasFor(List<Thought> thoughts) {
        List<ThoughtMetrics.Delta> out = new ArrayList<>(thoughts.size());
        for (Thought t : thoughts) {
            List<Thought> window = graph.getPrecedingThoughts(t.id, cfg.windowSize);
            out.add(metrics.delta(t, window));
        }
        return out;
    }

    private static Running fold(Running base, List<ThoughtMetrics.Delta> deltas) {
        if (deltas.isEmpty()) return base;

        int total = base.count + deltas.size();
        double keep = (double) base.count / total;

        double coh = base.coherence * keep;
        double con = base.contradiction * keep;
        double gain = base.informationGain * keep;
        double red = base.redundancy * keep;
        for (ThoughtMetrics.Delta d : deltas) {
            coh += d.coherence / total;
            con += d.contradiction / total;
            gain += d.informationGain / total;
            red += d.redundancy / total;
        }
        return new Running(coh, con, gain, red, total);
    }

    private EvaluationResult finish(String branchId, Running acc, List<Thought> thoughts) {
        if (acc.count == 0) return EvaluationResult.neutral(weights);

        double gradient = ThoughtMetrics.confidenceGradient(thoughts, cfg.gradientWindow);
        double goalAlignment = goalAlignment(branchId, thoughts);
        return EvaluationResult.of(acc.coherence, acc.contradiction, acc.informationGain, acc.redundancy,
                goalAlignment, gradient, acc.count, weights);
    }

    private double goalAlignment(String branchId, List<Thought> thoughts) {
        String g = goal;
        if (g == null) return 0.5;

        if (cfg.embeddingGoalAlignment) {
            Optional<float[]> center = graph.getBranch(branchId)
                    .flatMap(Branch::semanticProfile)
                    .map(SemanticProfile::centerEmbedding);
            if (center.isPresent()) return metrics.embeddingGoalAlignment(g, center.get());
        }
        return metrics.termGoalAlignment(g, thoughts, cfg.goalWindow);
    }

    private static EvaluationResult await(CompletableFuture<EvaluationResult> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }
}
