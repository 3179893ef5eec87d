package com.csvstruct.exception;

/**
 * Exception thrown when a codec invariant is violated.
 *
 * <p>This signals misuse of a codec or a bug in a collaborator, never malformed
 * user input, and must not be caught and converted into a null result. The
 * canonical case is a single-record parser that produces more than one record.
 */
public class InternalCodecException extends IllegalStateException {

    public static final String ERROR_CLASS = "INTERNAL_ERROR";

    public InternalCodecException(String message) {
        super("[" + ERROR_CLASS + "] " + message);
    }

    public InternalCodecException(String message, Throwable cause) {
        super("[" + ERROR_CLASS + "] " + message, cause);
    }
}
