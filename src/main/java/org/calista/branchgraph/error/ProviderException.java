package org.calista.branchgraph.error;

/**
 * Embedding provider failed or did not answer in time.
 * Always retryable.
 */
public final class ProviderException extends GraphException {

    public ProviderException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_ERROR, message, cause);
    }

    private ProviderException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static ProviderException timeout(long timeoutMs, Throwable cause) {
        return new ProviderException(ErrorCode.PROVIDER_TIMEOUT, "Embedding provider timed out after " + timeoutMs + "ms", cause);
    }
}
