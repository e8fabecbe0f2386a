package org.calista.branchgraph.embed.impl;

import org.calista.branchgraph.embed.EmbeddingProvider;
import org.calista.branchgraph.embed.Vectors;
import org.calista.branchgraph.text.TermExtractor;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * HashingEmbeddingProvider: детерминированный эмбеддер без модели.
 *
 * <p>Signed feature hashing of content terms and adjacent-term bigrams (FNV-1a 64 + mix64),
 * with separate namespaces for terms and bigrams. Output is L2-normalized.
 * Same text always yields the same vector, on any JVM.</p>
 */
public final class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final TermExtractor terms;
    private final int dimension;
    private final float bigramWeight;

    public HashingEmbeddingProvider(TermExtractor terms, int dimension) {
        this(terms, dimension, 0.5f);
    }

    public HashingEmbeddingProvider(TermExtractor terms, int dimension, float bigramWeight) {
        this.terms = Objects.requireNonNull(terms, "terms");
        if (dimension < 1) throw new IllegalArgumentException("dimension must be positive: " + dimension);
        this.dimension = dimension;
        this.bigramWeight = bigramWeight;
    }

    public int dimension() {
        return dimension;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorize(text));
    }

    float[] vectorize(String text) {
        float[] v = new float[dimension];
        List<String> toks = terms.termList(text);
        for (String t : toks) add(v, hashToken(t), 1.0f);
        for (int i = 0; i + 1 < toks.size(); i++) add(v, hashBigram(toks.get(i), toks.get(i + 1)), bigramWeight);
        Vectors.l2NormalizeInPlace(v);
        return v;
    }

    private void add(float[] v, long h, float w) {
        int idx = (int) Long.remainderUnsigned(h >>> 1, dimension);
        v[idx] += ((h & 1L) == 0L) ? w : -w;
    }

    private static long hashToken(String t) {
        // namespace "tok:"
        long h = FNV_OFFSET;
        h = fnv1a64(h, 't'); h = fnv1a64(h, 'o'); h = fnv1a64(h, 'k'); h = fnv1a64(h, ':');
        for (int i = 0; i < t.length(); i++) h = fnv1a64(h, t.charAt(i));
        return mix64(h);
    }

    private static long hashBigram(String a, String b) {
        // namespace "bg:"
        long h = FNV_OFFSET;
        h = fnv1a64(h, 'b'); h = fnv1a64(h, 'g'); h = fnv1a64(h, ':');
        for (int i = 0; i < a.length(); i++) h = fnv1a64(h, a.charAt(i));
        h = fnv1a64(h, '_');
        for (int i = 0; i < b.length(); i++) h = fnv1a64(h, b.charAt(i));
        return mix64(h);
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
}
