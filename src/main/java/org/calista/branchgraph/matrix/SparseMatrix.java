package org.calista.branchgraph.matrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Sparse 2-D matrix of doubles keyed by (row, col).
 *
 * <p>Only cells with {@code |value| >= threshold} are stored; writing a smaller value deletes the cell.
 * Rows are indexed separately so a row scan costs O(non-zero in row).</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class SparseMatrix {

    private final int rows;
    private final int cols;
    private final double threshold;
    private final Map<Integer, Map<Integer, Double>> data = new HashMap<>();
    private int nonZero;

    public SparseMatrix(int rows, int cols, double threshold) {
        if (rows < 1 || cols < 1) throw new IllegalArgumentException("rows/cols must be positive: " + rows + "x" + cols);
        if (!Double.isFinite(threshold) || threshold < 0.0) throw new IllegalArgumentException("threshold must be >= 0: " + threshold);
        this.rows = rows;
        this.cols = cols;
        this.threshold = threshold;
    }

    public void set(int row, int col, double value) {
        checkBounds(row, col);
        if (Math.abs(value) >= threshold && value != 0.0) {
            Double prev = data.computeIfAbsent(row, r -> new HashMap<>()).put(col, value);
            if (prev == null) nonZero++;
            return;
        }
        Map<Integer, Double> r = data.get(row);
        if (r != null && r.remove(col) != null) {
            nonZero--;
            if (r.isEmpty()) data.remove(row);
        }
    }

    /** Stored value, or 0 when absent. */
    public double get(int row, int col) {
        checkBounds(row, col);
        Map<Integer, Double> r = data.get(row);
        if (r == null) return 0.0;
        Double v = r.get(col);
        return v == null ? 0.0 : v;
    }

    public OptionalDouble find(int row, int col) {
        checkBounds(row, col);
        Map<Integer, Double> r = data.get(row);
        Double v = r == null ? null : r.get(col);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    /** Read-only view of the non-zero cells of a row: col → value. */
    public Map<Integer, Double> row(int row) {
        if (row < 0 || row >= rows) throw new IndexOutOfBoundsException("row " + row + " outside [0," + rows + ")");
        Map<Integer, Double> r = data.get(row);
        return r == null ? Map.of() : Collections.unmodifiableMap(r);
    }

    public List<Entry> nonZeroEntries() {
        List<Entry> out = new ArrayList<>(nonZero);
        for (Map.Entry<Integer, Map<Integer, Double>> r : data.entrySet()) {
            for (Map.Entry<Integer, Double> c : r.getValue().entrySet()) {
                out.add(new Entry(r.getKey(), c.getKey(), c.getValue()));
            }
        }
        return out;
    }

    /**
     * Copy with new dimensions. Entries outside the new bounds are dropped.
     */
    public SparseMatrix resized(int newRows, int newCols) {
        SparseMatrix m = new SparseMatrix(newRows, newCols, threshold);
        for (Entry e : nonZeroEntries()) {
            if (e.row < newRows && e.col < newCols) m.set(e.row, e.col, e.value);
        }
        return m;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double threshold() {
        return threshold;
    }

    public int nonZeroCount() {
        return nonZero;
    }

    public Stats stats() {
        double total = (double) rows * cols;
        double sparsity = total == 0 ? 1.0 : 1.0 - (nonZero / total);
        // key + value, roughly
        long memory = (long) nonZero * 16L;
        return new Stats(rows, cols, nonZero, sparsity, threshold, memory);
    }

    private void checkBounds(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("cell (" + row + "," + col + ") outside " + rows + "x" + cols);
        }
    }

    public static final class Entry {
        public final int row;
        public final int col;
        public final double value;

        public Entry(int row, int col, double value) {
            this.row = row;
            this.col = col;
            this.value = value;
        }
    }

    public static final class Stats {
        public final int rows;
        public final int cols;
        public final int nonZero;
        public final double sparsity;
        public final double threshold;
        public final long approxMemoryBytes;

        public Stats(int rows, int cols, int nonZero, double sparsity, double threshold, long approxMemoryBytes) {
            this.rows = rows;
            this.cols = cols;
            this.nonZero = nonZero;
            this.sparsity = sparsity;
            this.threshold = threshold;
            this.approxMemoryBytes = approxMemoryBytes;
        }
    }
}
