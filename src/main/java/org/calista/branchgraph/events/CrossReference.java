package org.calista.branchgraph.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Typed link between two branches. Lives only in the event log.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CrossReference {
    public String fromBranch;
    public String toBranch;
    public CrossRefKind kind;
    public String reason;
    public double strength;

    public static CrossReference of(String fromBranch, String toBranch, CrossRefKind kind, String reason, double strength) {
        CrossReference r = new CrossReference();
        r.fromBranch = fromBranch;
        r.toBranch = toBranch;
        r.kind = kind;
        r.reason = reason;
        r.strength = strength;
        return r;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CrossReference r)) return false;
        return Double.compare(strength, r.strength) == 0
                && Objects.equals(fromBranch, r.fromBranch)
                && Objects.equals(toBranch, r.toBranch)
                && kind == r.kind
                && Objects.equals(reason, r.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromBranch, toBranch, kind, reason, strength);
    }

    @Override
    public String toString() {
        return "CrossReference{" + fromBranch + " -" + kind + "-> " + toBranch + ", strength=" + strength + '}';
    }
}
