package org.calista.branchgraph.evaluate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.graph.Branch;
import org.calista.branchgraph.graph.BranchGraph;
import org.calista.branchgraph.graph.BranchState;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Branch-level decisions driven by evaluation scores: contradiction report and pruning.
 *
 * <p>Branches are visited in creation order. A stale evaluation never prunes a branch.</p>
 */
public final class BranchReview {
    private static final Logger log = LogManager.getLogger(BranchReview.class);

    private final BranchGraph graph;
    private final DifferentialEvaluator evaluator;
    private final EngineConfig cfg;

    public BranchReview(BranchGraph graph, DifferentialEvaluator evaluator) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.cfg = graph.config();
    }

    // ----------------------------- contradictions -----------------------------

    public List<ContradictionReport> findContradictions() {
        return findContradictions(cfg.evaluation.thresholds.contradiction);
    }

    /**
     * Branches whose evaluated contradiction score is above {@code threshold}.
     */
    public List<ContradictionReport> findContradictions(double threshold) {
        List<ContradictionReport> out = new ArrayList<>();
        for (Branch b : graph.getAllBranches()) {
            EvaluationResult r = evaluator.evaluateIncremental(b.id);
            if (r.contradiction > threshold) {
                out.add(new ContradictionReport(b.id, r.contradiction, r.stale,
                        String.format(Locale.ROOT, "Internal contradictions detected (%.1f%% of thought pairs)",
                                r.contradiction * 100.0)));
            }
        }
        return out;
    }

    // ----------------------------- pruning -----------------------------

    public List<String> pruneLowScoring() {
        return pruneLowScoring(cfg.branch.pruneThreshold);
    }

    /**
     * Marks every active branch whose overall score is below {@code threshold} as
     * {@link BranchState#DEAD_END}. Each change is recorded as a state event.
     *
     * @return ids of the pruned branches
     */
    public List<String> pruneLowScoring(double threshold) {
        List<String> pruned = new ArrayList<>();
        for (Branch b : graph.getAllBranches()) {
            if (b.state != BranchState.ACTIVE) continue;

            EvaluationResult r = evaluator.evaluateIncremental(b.id);
            if (r.stale) {
                log.warn("Prune skipped {}: evaluation is stale", b.id);
                continue;
            }
            if (r.overallScore < threshold && graph.setBranchState(b.id, BranchState.DEAD_END)) {
                pruned.add(b.id);
            }
        }
        if (!pruned.isEmpty()) log.info("Pruned {} branch(es) below {}: {}", pruned.size(), threshold, pruned);
        return pruned;
    }

    // ----------------------------- results -----------------------------

    public static final class ContradictionReport {
        public final String branchId;
        public final double contradiction;
        public final boolean stale;
        public final String reason;

        public ContradictionReport(String branchId, double contradiction, boolean stale, String reason) {
            this.branchId = branchId;
            this.contradiction = contradiction;
            this.stale = stale;
            this.reason = reason;
        }

        @Override
        public String toString() {
            return "ContradictionReport{" + branchId + ", " + reason + (stale ? ", stale" : "") + '}';
        }
    }
}
