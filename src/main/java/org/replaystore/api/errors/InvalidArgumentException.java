package org.replaystore.api.errors;

/**
 * Thrown when a request is malformed: bad slice ranges, chunk key collisions,
 * rejected priorities or data that does not match the table signature.
 */
public class InvalidArgumentException extends TableException {

    public InvalidArgumentException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ARGUMENT, message, cause);
    }
}
