package org.calista.branchgraph.embed;

import java.util.concurrent.CompletableFuture;

/**
 * Source of dense text embeddings. May be remote and slow; callers bound the wait.
 */
public interface EmbeddingProvider {

    CompletableFuture<float[]> embed(String text);

    /**
     * Cosine similarity of two vectors of equal length. 0 for empty, mismatched or zero vectors.
     */
    default double cosineSimilarity(float[] a, float[] b) {
        return Vectors.cosine(a, b);
    }
}
