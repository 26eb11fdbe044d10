package org.replaystore.api.errors;

/**
 * Error kinds a table operation can report to its caller.
 * <p>
 * The codes map one-to-one onto the status codes of the service layer that
 * exposes tables to remote clients.
 */
public enum ErrorCode {
    /** Unknown item or chunk key. */
    NOT_FOUND,
    /** Malformed request, e.g. an out-of-range slice or a signature mismatch. */
    INVALID_ARGUMENT,
    /** The operation is not allowed in the current state. */
    FAILED_PRECONDITION,
    /** No room can be made for an insert. */
    RESOURCE_EXHAUSTED,
    /** A blocked call was aborted by its caller, a deadline or table shutdown. */
    CANCELLED
}
