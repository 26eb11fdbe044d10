package org.replaystore.api.errors;

/**
 * Thrown when an operation is not allowed in the current state, e.g. binding an
 * extension that is already bound to a table, or sampling a prioritized
 * distribution whose weights sum to zero.
 */
public class FailedPreconditionException extends TableException {

    public FailedPreconditionException(String message) {
        super(ErrorCode.FAILED_PRECONDITION, message);
    }

    public FailedPreconditionException(String message, Throwable cause) {
        super(ErrorCode.FAILED_PRECONDITION, message, cause);
    }
}
