package com.csvstruct.csv;

import com.csvstruct.exception.MalformedRecordException;
import com.csvstruct.row.Row;
import com.csvstruct.row.RowBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Applies the parse mode to a {@link RecordParser}.
 *
 * <p>Rows from the raw parser are aligned to the actual required schema; this class
 * widens them into the output schema, leaving the corrupt-record field null. When the
 * raw parser rejects the input, or produces no record at all:
 * <ul>
 *   <li>{@code PERMISSIVE} yields one row with every field null and the input text in
 *       the corrupt-record field, if the output schema has one</li>
 *   <li>{@code DROPMALFORMED} yields nothing</li>
 *   <li>{@code FAILFAST} throws {@link MalformedRecordException}</li>
 * </ul>
 */
public class FailureSafeParser {

    private static final Logger logger = LoggerFactory.getLogger(FailureSafeParser.class);

    private final RecordParser rawParser;
    private final ParseMode mode;
    private final ResolvedSchema schema;
    /** Position in the raw row of each output field, -1 for the corrupt field. */
    private final int[] rawIndexes;

    public FailureSafeParser(RecordParser rawParser, ParseMode mode, ResolvedSchema schema) {
        this.rawParser = rawParser;
        this.mode = mode;
        this.schema = schema;

        int outputSize = schema.outputSchema().size();
        this.rawIndexes = new int[outputSize];
        int next = 0;
        for (int i = 0; i < outputSize; i++) {
            rawIndexes[i] = i == schema.corruptFieldIndex() ? -1 : next++;
        }
    }

    /**
     * Parses the input under the configured mode.
     *
     * @param input the text
     * @return the rows, aligned to the output schema
     * @throws MalformedRecordException under {@code FAILFAST} when the input is malformed
     */
    public List<Row> parse(String input) {
        Iterator<Row> records;
        try {
            records = rawParser.parse(input);
        } catch (BadRecordException e) {
            return handleMalformed(input, e);
        }

        if (!records.hasNext()) {
            return handleMalformed(input, null);
        }
        List<Row> rows = new ArrayList<>(1);
        while (records.hasNext()) {
            rows.add(toResultRow(records.next(), null));
        }
        return rows;
    }

    private List<Row> handleMalformed(String input, BadRecordException e) {
        switch (mode) {
            case PERMISSIVE:
                if (logger.isDebugEnabled()) {
                    logger.debug("Replacing malformed CSV record with nulls: {}",
                        e == null ? "no record in input" : e.getMessage());
                }
                return Collections.singletonList(toResultRow(null, input));
            case DROP_MALFORMED:
                return Collections.emptyList();
            case FAIL_FAST:
            default:
                throw new MalformedRecordException(input, mode.optionName(), e == null ? null : e.getCause());
        }
    }

    private Row toResultRow(Row raw, String badRecord) {
        RowBuilder row = new RowBuilder(rawIndexes.length);
        for (int i = 0; i < rawIndexes.length; i++) {
            if (rawIndexes[i] < 0) {
                row.set(i, badRecord);
            } else if (raw != null) {
                row.set(i, raw.get(rawIndexes[i]));
            }
        }
        return row.build();
    }

    public ParseMode mode() {
        return mode;
    }

    public ResolvedSchema schema() {
        return schema;
    }
}
