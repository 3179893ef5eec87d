package com.csvstruct.csv;

import com.csvstruct.row.Row;

import java.util.Iterator;

/**
 * Converts a text value into the records it contains.
 */
@FunctionalInterface
public interface RecordParser {

    /**
     * Parses the input.
     *
     * @param input the text, may be null
     * @return the parsed records, each aligned to the parser's required schema
     * @throws BadRecordException if a record is malformed
     */
    Iterator<Row> parse(String input) throws BadRecordException;
}
