package org.calista.branchgraph.embed;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.error.ProviderException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking front of an {@link EmbeddingProvider}: bounded wait plus a small LRU of vectors by text.
 * Failed lookups are never cached. A request that times out is cancelled.
 */
public final class EmbeddingGateway {
    private static final Logger log = LogManager.getLogger(EmbeddingGateway.class);

    private final EmbeddingProvider provider;
    private final long timeoutMs;
    private final Map<String, float[]> cache;

    public EmbeddingGateway(EmbeddingProvider provider, long timeoutMs, int cacheSize) {
        this.provider = Objects.requireNonNull(provider, "provider");
        if (timeoutMs < 1) throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        this.timeoutMs = timeoutMs;
        final int cap = Math.max(1, cacheSize);
        this.cache = new LinkedHashMap<>(Math.min(cap, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
                return size() > cap;
            }
        };
    }

    /**
     * @throws ProviderException on provider error or timeout
     */
    public float[] embed(String text) {
        Objects.requireNonNull(text, "text");
        synchronized (cache) {
            float[] hit = cache.get(text);
            if (hit != null) return hit;
        }

        float[] v = await(text);

        synchronized (cache) {
            cache.put(text, v);
        }
        return v;
    }

    public double similarity(String a, String b) {
        return provider.cosineSimilarity(embed(a), embed(b));
    }

    public double cosine(float[] a, float[] b) {
        return provider.cosineSimilarity(a, b);
    }

    public void clear() {
        synchronized (cache) {
            cache.clear();
        }
    }

    private float[] await(String text) {
        Future<float[]> pending = null;
        try {
            pending = provider.embed(text);
            if (pending == null) throw new ProviderException("Embedding provider returned no future", null);
            float[] v = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (v == null) throw new ProviderException("Embedding provider returned null", null);
            return v;
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("Embedding timed out after {}ms, request cancelled", timeoutMs);
            throw ProviderException.timeout(timeoutMs, e);
        } catch (InterruptedException e) {
            if (pending != null) pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for embedding", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Embedding provider failed: {}", cause.toString());
            throw new ProviderException("Embedding provider failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            if (e instanceof ProviderException pe) throw pe;
            log.warn("Embedding provider failed: {}", e.toString());
            throw new ProviderException("Embedding provider failed: " + e.getMessage(), e);
        }
    }
}
