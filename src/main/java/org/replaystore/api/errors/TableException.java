package org.replaystore.api.errors;

/**
 * Base class of all errors returned by table operations.
 * <p>
 * These are checked exceptions: every one of them describes a condition the
 * caller can react to (retry, report, drop the request). A table operation that
 * throws a {@code TableException} leaves no partial mutation behind.
 * <p>
 * Corrupted internal state is reported with {@link IllegalStateException}
 * instead, which is not meant to be caught.
 */
public abstract class TableException extends Exception {

    private final ErrorCode code;

    /**
     * Creates a TableException with the specified code and message.
     *
     * @param code    The error kind
     * @param message Description of the failure
     */
    protected TableException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Creates a TableException with the specified code, message and cause.
     *
     * @param code    The error kind
     * @param message Description of the failure
     * @param cause   The underlying exception
     */
    protected TableException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Returns the error kind of this exception.
     *
     * @return the error code, never null
     */
    public ErrorCode getCode() {
        return code;
    }
}
