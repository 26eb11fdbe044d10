package org.replaystore.api.errors;

/**
 * Thrown when an item or chunk key is not present.
 */
public class NotFoundException extends TableException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
