package org.calista.branchgraph.embed;

import org.calista.branchgraph.error.ErrorCode;
import org.calista.branchgraph.error.ProviderException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmbeddingGatewayTest {

    @Test
    void cachesSuccessfulEmbeddings() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingProvider p = text -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(new float[]{1f, 0f});
        };
        EmbeddingGateway g = new EmbeddingGateway(p, 1000, 16);

        g.embed("x");
        g.embed("x");
        assertEquals(1, calls.get());

        g.clear();
        g.embed("x");
        assertEquals(2, calls.get());
    }

    @Test
    void timeoutSurfacesAsRetryableProviderException() {
        CompletableFuture<float[]> pending = new CompletableFuture<>();
        EmbeddingGateway g = new EmbeddingGateway(text -> pending, 20, 16);

        ProviderException e = assertThrows(ProviderException.class, () -> g.embed("slow"));
        assertEquals(ErrorCode.PROVIDER_TIMEOUT, e.code());
        assertTrue(e.retryable());
        assertTrue(pending.isCancelled(), "timed-out request must be cancelled");
    }

    @Test
    void failedFutureSurfacesAsProviderError() {
        EmbeddingProvider broken = text -> CompletableFuture.failedFuture(new IllegalStateException("model offline"));
        EmbeddingGateway g = new EmbeddingGateway(broken, 1000, 16);

        ProviderException e = assertThrows(ProviderException.class, () -> g.embed("x"));
        assertEquals(ErrorCode.PROVIDER_ERROR, e.code());
        assertTrue(e.getMessage().contains("model offline"));
    }

    @Test
    void throwingProviderSurfacesAsProviderError() {
        EmbeddingProvider broken = text -> {
            throw new IllegalStateException("boom");
        };
        EmbeddingGateway g = new EmbeddingGateway(broken, 1000, 16);
        assertThrows(ProviderException.class, () -> g.embed("x"));
    }
}
