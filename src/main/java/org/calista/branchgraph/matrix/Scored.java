package org.calista.branchgraph.matrix;

import java.util.Objects;

/**
 * Small immutable scored wrapper.
 * Natural order: score descending, then {@code String.valueOf(item)} ascending.
 */
public final class Scored<T> implements Comparable<Scored<T>> {
    public final T item;
    public final double score;

    public Scored(T item, double score) {
        this.item = item;
        this.score = score;
    }

    public static <T> Scored<T> of(T item, double score) {
        return new Scored<>(item, score);
    }

    @Override
    public int compareTo(Scored<T> o) {
        int c = Double.compare(o.score, this.score);
        if (c != 0) return c;
        return String.valueOf(this.item).compareTo(String.valueOf(o.item));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Scored<?> s)) return false;
        return Double.doubleToLongBits(score) == Double.doubleToLongBits(s.score)
                && Objects.equals(item, s.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, Double.doubleToLongBits(score));
    }

    @Override
    public String toString() {
        return "Scored{score=" + score + ", item=" + item + '}';
    }
}
