package com.csvstruct.exception;

/**
 * Exception thrown when a record cannot be parsed under the {@code FAILFAST} mode.
 *
 * <p>This aborts the enclosing operation: it is neither retried nor skipped. The
 * message names the offending record text and the parse mode, and suggests the
 * {@code PERMISSIVE} mode as an alternative.
 *
 * <p>Example message:
 * <pre>
 *   [MALFORMED_RECORD_IN_PARSING] Malformed records are detected in record parsing: '1,abc'.
 *   Parse Mode: FAILFAST. To process malformed records as null result, try setting
 *   the option 'mode' as 'PERMISSIVE'.
 * </pre>
 */
public class MalformedRecordException extends RuntimeException {

    public static final String ERROR_CLASS = "MALFORMED_RECORD_IN_PARSING";

    private final String badRecord;

    /**
     * Creates a malformed record exception.
     *
     * @param badRecord the raw record text, may be null when unavailable
     * @param parseMode the name of the parse mode in effect
     * @param cause the parse failure
     */
    public MalformedRecordException(String badRecord, String parseMode, Throwable cause) {
        super(String.format(
            "[%s] Malformed records are detected in record parsing: '%s'. Parse Mode: %s. "
                + "To process malformed records as null result, try setting the option 'mode' as 'PERMISSIVE'.",
            ERROR_CLASS, badRecord, parseMode), cause);
        this.badRecord = badRecord;
    }

    /**
     * Returns the raw text of the record that failed to parse.
     *
     * @return the record text, or null if not available
     */
    public String getBadRecord() {
        return badRecord;
    }

    public String getErrorClass() {
        return ERROR_CLASS;
    }
}
