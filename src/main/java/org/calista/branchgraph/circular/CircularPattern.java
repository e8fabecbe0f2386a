package org.calista.branchgraph.circular;

import java.util.List;
import java.util.Locale;

/**
 * One detected circular-reasoning pattern. {@code thoughtIds} lists the distinct cycle members in cycle order.
 */
public final class CircularPattern {

    public final CycleKind kind;
    public final List<String> thoughtIds;
    public final double confidence;
    public final String description;

    public CircularPattern(CycleKind kind, List<String> thoughtIds, double confidence, String description) {
        this.kind = kind;
        this.thoughtIds = List.copyOf(thoughtIds);
        this.confidence = confidence;
        this.description = description;
    }

    public String brief() {
        return String.format(Locale.ROOT, "%s conf=%.2f %s", kind, confidence, String.join(" -> ", thoughtIds));
    }

    @Override
    public String toString() {
        return "CircularPattern{" + brief() + '}';
    }
}
