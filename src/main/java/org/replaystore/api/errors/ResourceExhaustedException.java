package org.replaystore.api.errors;

/**
 * Thrown when an insert cannot make room under the table's maximum size.
 */
public class ResourceExhaustedException extends TableException {

    public ResourceExhaustedException(String message) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message, cause);
    }
}
