package com.csvstruct.csv;

/**
 * Raised by a {@link RecordParser} when a record cannot be converted.
 *
 * <p>Never escapes the codec: {@link FailureSafeParser} turns it into a null row
 * or a {@link com.csvstruct.exception.MalformedRecordException} depending on the
 * parse mode.
 */
public class BadRecordException extends Exception {

    private final String record;

    public BadRecordException(String record, Throwable cause) {
        super("Malformed CSV record: " + (cause == null ? record : cause.getMessage()), cause);
        this.record = record;
    }

    /**
     * Returns the raw text of the record that failed.
     *
     * @return the record text
     */
    public String getRecord() {
        return record;
    }
}
