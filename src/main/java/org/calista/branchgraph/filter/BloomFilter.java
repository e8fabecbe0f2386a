package org.calista.branchgraph.filter;

import org.calista.branchgraph.error.ConfigurationException;

import java.util.BitSet;
import java.util.Locale;
import java.util.Objects;

/**
 * Classic bloom filter over strings.
 *
 * <p>Sizing: {@code m = ceil(-n·ln p / ln²2)} bits, {@code k = ceil(m/n · ln 2)} hashes.
 * Each of the k positions comes from an independently seeded FNV-1a 64 hash.
 * {@link #contains} never returns a false negative.</p>
 *
 * <p>Not thread-safe; owners synchronize.</p>
 */
public final class BloomFilter {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final int size;
    private final int hashFunctions;
    private final int expectedElements;
    private final double targetFalsePositiveRate;
    private final BitSet bits;
    private long count;

    public BloomFilter(int expectedElements, double falsePositiveRate) {
        if (expectedElements < 1) {
            throw new ConfigurationException("expectedElements must be positive: " + expectedElements);
        }
        if (!(falsePositiveRate > 0.0 && falsePositiveRate < 1.0)) {
            throw new ConfigurationException("falsePositiveRate must be in (0,1): " + falsePositiveRate);
        }
        this.expectedElements = expectedElements;
        this.targetFalsePositiveRate = falsePositiveRate;
        this.size = optimalSize(expectedElements, falsePositiveRate);
        this.hashFunctions = optimalHashFunctions(size, expectedElements);
        this.bits = new BitSet(size);
    }

    static int optimalSize(int n, double p) {
        double ln2 = Math.log(2);
        double m = Math.ceil(-n * Math.log(p) / (ln2 * ln2));
        if (m > Integer.MAX_VALUE) throw new ConfigurationException("Bloom filter too large for n=" + n + ", p=" + p);
        return (int) Math.max(1, m);
    }

    static int optimalHashFunctions(int m, int n) {
        return (int) Math.max(1, Math.ceil(((double) m / n) * Math.log(2)));
    }

    // ----------------------------- public API -----------------------------

    public void add(String item) {
        Objects.requireNonNull(item, "item");
        for (int i = 0; i < hashFunctions; i++) bits.set(index(item, i));
        count++;
    }

    public boolean contains(String item) {
        if (item == null) return false;
        for (int i = 0; i < hashFunctions; i++) {
            if (!bits.get(index(item, i))) return false;
        }
        return true;
    }

    /**
     * Estimated current false-positive rate: {@code (1 - e^(-k·count/m))^k}.
     */
    public double getFalsePositiveRate() {
        double exp = Math.exp(-((double) hashFunctions * count) / size);
        return Math.pow(1.0 - exp, hashFunctions);
    }

    public void clear() {
        bits.clear();
        count = 0;
    }

    public int size() {
        return size;
    }

    public int hashFunctions() {
        return hashFunctions;
    }

    /** Number of {@link #add} calls since construction or the last {@link #clear}. */
    public long count() {
        return count;
    }

    public Stats stats() {
        return new Stats(size, hashFunctions, expectedElements, count, targetFalsePositiveRate,
                getFalsePositiveRate(), (size + 7) / 8);
    }

    // ----------------------------- internals -----------------------------

    private int index(String item, int seed) {
        long h = FNV_OFFSET;
        h = fnv1a64(h, (char) ('0' + seed));
        h = fnv1a64(h, ':');
        for (int i = 0; i < item.length(); i++) h = fnv1a64(h, item.charAt(i));
        h = mix64(h);
        return (int) Long.remainderUnsigned(h, size);
    }

    private static long fnv1a64(long h, char c) {
        h ^= (c & 0xFFFF);
        return h * FNV_PRIME;
    }

    private static long mix64(long x) {
        x ^= (x >>> 33);
        x *= 0xff51afd7ed558ccdL;
        x ^= (x >>> 33);
        x *= 0xc4ceb9fe1a85ec53L;
        x ^= (x >>> 33);
        return x;
    }

    public static final class Stats {
        public final int size;
        public final int hashFunctions;
        public final int expectedElements;
        public final long numElements;
        public final double targetFalsePositiveRate;
        public final double falsePositiveRate;
        public final int sizeInBytes;

        public Stats(int size, int hashFunctions, int expectedElements, long numElements,
                     double targetFalsePositiveRate, double falsePositiveRate, int sizeInBytes) {
            this.size = size;
            this.hashFunctions = hashFunctions;
            this.expectedElements = expectedElements;
            this.numElements = numElements;
            this.targetFalsePositiveRate = targetFalsePositiveRate;
            this.falsePositiveRate = falsePositiveRate;
            this.sizeInBytes = sizeInBytes;
        }

        public String brief() {
            return String.format(Locale.ROOT, "bits=%d k=%d n=%d fpr=%.6f", size, hashFunctions, numElements, falsePositiveRate);
        }
    }
}
