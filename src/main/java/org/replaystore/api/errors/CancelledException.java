package org.replaystore.api.errors;

/**
 * Thrown when a rate limited call is aborted while waiting: the calling thread was
 * interrupted, the deadline expired or the table was closed. Counters are left
 * untouched.
 */
public class CancelledException extends TableException {

    public CancelledException(String message) {
        super(ErrorCode.CANCELLED, message);
    }

    public CancelledException(String message, Throwable cause) {
        super(ErrorCode.CANCELLED, message, cause);
    }
}
