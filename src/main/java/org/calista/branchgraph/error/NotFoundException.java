package org.calista.branchgraph.error;

public final class NotFoundException extends GraphException {

    public NotFoundException(ErrorCode code, String message) {
        super(code, message);
    }

    public static NotFoundException branch(String branchId) {
        return new NotFoundException(ErrorCode.BRANCH_NOT_FOUND, "Branch not found: " + branchId);
    }

    public static NotFoundException thought(String thoughtId) {
        return new NotFoundException(ErrorCode.THOUGHT_NOT_FOUND, "Thought not found: " + thoughtId);
    }
}
