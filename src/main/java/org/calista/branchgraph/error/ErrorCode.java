package org.calista.branchgraph.error;

/**
 * Stable machine-readable error codes.
 * The retryable flag is the default for the code; exceptions may carry it through unchanged.
 */
public enum ErrorCode {
    INVALID_INPUT(false),
    DUPLICATE_BRANCH(false),
    BRANCH_NOT_FOUND(false),
    THOUGHT_NOT_FOUND(false),
    CONFIGURATION_ERROR(false),
    PROVIDER_ERROR(true),
    PROVIDER_TIMEOUT(true),
    INTERNAL_ERROR(true);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
