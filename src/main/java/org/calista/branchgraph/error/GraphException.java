package org.calista.branchgraph.error;

import java.util.Objects;

/**
 * Base of every failure raised by the engine.
 * Unchecked: callers that want a structured envelope use {@link Outcome#of}.
 */
public class GraphException extends RuntimeException {

    private final ErrorCode code;

    public GraphException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public GraphException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }

    public boolean retryable() {
        return code.retryable();
    }
}
