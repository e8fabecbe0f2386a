package org.calista.branchgraph.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Uniform result envelope for callers at the edge:
 * {@code {ok:true, value}} or {@code {ok:false, code, message, retryable}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Outcome<T> {
    private static final Logger log = LogManager.getLogger(Outcome.class);

    public final boolean ok;
    public final T value;
    public final ErrorCode code;
    public final String message;
    public final Boolean retryable;

    private Outcome(boolean ok, T value, ErrorCode code, String message, Boolean retryable) {
        this.ok = ok;
        this.value = value;
        this.code = code;
        this.message = message;
        this.retryable = retryable;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(true, value, null, null, null);
    }

    public static <T> Outcome<T> failure(ErrorCode code, String message, boolean retryable) {
        return new Outcome<>(false, null, Objects.requireNonNull(code, "code"), message, retryable);
    }

    public static <T> Outcome<T> failure(GraphException e) {
        return failure(e.code(), e.getMessage(), e.retryable());
    }

    /**
     * Runs the action and maps engine exceptions onto their codes.
     * Anything else becomes {@link ErrorCode#INTERNAL_ERROR}.
     */
    public static <T> Outcome<T> of(Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        try {
            return success(action.get());
        } catch (GraphException e) {
            log.debug("Outcome failure: code={}, message={}", e.code(), e.getMessage());
            return failure(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return failure(ErrorCode.INTERNAL_ERROR, msg, ErrorCode.INTERNAL_ERROR.retryable());
        }
    }

    public boolean isOk() {
        return ok;
    }

    public T orElseThrow() {
        if (!ok) throw new NoSuchElementException("Outcome failed: " + code + " " + message);
        return value;
    }

    @Override
    public String toString() {
        return ok
                ? "Outcome{ok=true, value=" + value + '}'
                : "Outcome{ok=false, code=" + code + ", message=" + message + ", retryable=" + retryable + '}';
    }
}
