package com.csvstruct.csv;

import com.opencsv.ICSVParser;

import java.io.IOException;

/**
 * Splits one CSV record into tokens with opencsv.
 *
 * <p>The escape character only has meaning in front of the quote character or another
 * escape character. Anywhere else it is kept as ordinary text, so {@code C:\temp}
 * reads back unchanged. opencsv drops an escape character it cannot pair, so before
 * tokenizing, each meaningful escape is rewritten to {@link #ESCAPE_SENTINEL} and the
 * opencsv parser is configured with the sentinel as its escape character.
 *
 * <p>Records must not contain {@link #ESCAPE_SENTINEL}, a Unicode noncharacter.
 *
 * <p>Not thread-safe: opencsv parsers keep state between calls.
 */
public final class CsvTokenizer {

    /** Escape character handed to opencsv in place of the configured one. */
    static final char ESCAPE_SENTINEL = '\uFFFE';

    private final ICSVParser parser;
    private final char quote;
    private final char escape;

    /**
     * Creates a tokenizer.
     *
     * @param parser the opencsv parser, configured with {@link #ESCAPE_SENTINEL} as its
     *               escape character when {@code escape} is set
     * @param quote the configured quote character, or {@link CsvOptions#NO_CHAR}
     * @param escape the configured escape character, or {@link CsvOptions#NO_CHAR} when
     *               records are passed through unchanged
     */
    CsvTokenizer(ICSVParser parser, char quote, char escape) {
        this.parser = parser;
        this.quote = quote;
        this.escape = escape;
    }

    /**
     * Tokenizes one record.
     *
     * @param record the record text
     * @return the tokens, or null when opencsv yields none
     * @throws IOException if the record is malformed, e.g. an unterminated quote
     */
    public String[] parseLine(String record) throws IOException {
        return parser.parseLine(escape == CsvOptions.NO_CHAR ? record : markEscapes(record));
    }

    String markEscapes(String record) {
        if (record.indexOf(escape) < 0) {
            return record;
        }
        StringBuilder sb = new StringBuilder(record.length());
        int length = record.length();
        for (int i = 0; i < length; i++) {
            char c = record.charAt(i);
            if (c == escape && i + 1 < length && isEscapable(record.charAt(i + 1))) {
                sb.append(ESCAPE_SENTINEL).append(record.charAt(i + 1));
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private boolean isEscapable(char next) {
        return next == escape || (quote != CsvOptions.NO_CHAR && next == quote);
    }
}
