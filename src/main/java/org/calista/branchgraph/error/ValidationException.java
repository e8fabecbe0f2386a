package org.calista.branchgraph.error;

/** Malformed input. Raised before any state is touched. */
public final class ValidationException extends GraphException {

    public ValidationException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }

    public static ValidationException duplicateBranch(String branchId) {
        return new ValidationException(ErrorCode.DUPLICATE_BRANCH, "Branch already exists: " + branchId);
    }
}
