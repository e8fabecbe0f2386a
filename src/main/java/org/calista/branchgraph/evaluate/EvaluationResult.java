package org.calista.branchgraph.evaluate;

import org.calista.branchgraph.core.EngineConfig;

import java.util.Locale;

/**
 * Quality metrics of one branch. Every metric is in [0,1].
 *
 * <p>{@code contradiction} and {@code redundancy} are "lower is better"; they enter
 * {@link #overallScore} inverted. {@code stale} marks a result served from cache because the
 * embedding provider failed.</p>
 */
public final class EvaluationResult {

    public final double coherence;
    public final double contradiction;
    public final double informationGain;
    public final double redundancy;
    public final double goalAlignment;
    public final double confidenceGradient;
    public final double overallScore;

    /** Number of thoughts folded into the running means. */
    public final int thoughtCount;
    public final boolean stale;

    EvaluationResult(double coherence, double contradiction, double informationGain, double redundancy,
                     double goalAlignment, double confidenceGradient, double overallScore,
                     int thoughtCount, boolean stale) {
        this.coherence = coherence;
        this.contradiction = contradiction;
        this.informationGain = informationGain;
        this.redundancy = redundancy;
        this.goalAlignment = goalAlignment;
        this.confidenceGradient = confidenceGradient;
        this.overallScore = overallScore;
        this.thoughtCount = thoughtCount;
        this.stale = stale;
    }

    static EvaluationResult of(double coherence, double contradiction, double informationGain, double redundancy,
                               double goalAlignment, double confidenceGradient, int thoughtCount,
                               EngineConfig.Weights w) {
        double overall = w.coherence * coherence
                + w.contradiction * (1.0 - contradiction)
                + w.informationGain * informationGain
                + w.goalAlignment * goalAlignment
                + w.confidenceGradient * confidenceGradient
                + w.redundancy * (1.0 - redundancy);
        return new EvaluationResult(coherence, contradiction, informationGain, redundancy,
                goalAlignment, confidenceGradient, overall, thoughtCount, false);
    }

    /** Result for a branch without thoughts. */
    public static EvaluationResult neutral(EngineConfig.Weights w) {
        return of(1.0, 0.0, 1.0, 0.0, 0.5, 0.5, 0, w);
    }

    public EvaluationResult asStale() {
        if (stale) return this;
        return new EvaluationResult(coherence, contradiction, informationGain, redundancy,
                goalAlignment, confidenceGradient, overallScore, thoughtCount, true);
    }

    public String brief() {
        return String.format(Locale.ROOT,
                "score=%.4f coh=%.4f contra=%.4f gain=%.4f red=%.4f goal=%.4f grad=%.4f n=%d%s",
                overallScore, coherence, contradiction, informationGain, redundancy,
                goalAlignment, confidenceGradient, thoughtCount, stale ? " stale" : "");
    }

    @Override
    public String toString() {
        return "EvaluationResult{" + brief() + '}';
    }
}
