package com.csvstruct.csv;

import com.csvstruct.config.SessionConf;
import com.csvstruct.exception.AnalysisException;
import com.opencsv.CSVParserBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.RFC4180ParserBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Options bundle shared by the CSV decode, encode and inference paths.
 *
 * <p>Built once from a user-supplied option map plus engine settings. Keys are
 * case-insensitive. Invalid values surface as {@link AnalysisException} with error
 * class {@code INVALID_OPTION_VALUE}; unrecognized keys are ignored.
 *
 * <p>Example:
 * <pre>
 *   CsvOptions options = new CsvOptions(Map.of("sep", ";", "mode", "FAILFAST"), true, "UTC");
 *   options.delimiter();   // ';'
 *   options.parseMode();   // FAIL_FAST
 * </pre>
 */
public final class CsvOptions {

    private static final Logger logger = LoggerFactory.getLogger(CsvOptions.class);

    public static final String SEP = "sep";
    public static final String DELIMITER = "delimiter";
    public static final String QUOTE = "quote";
    public static final String ESCAPE = "escape";
    public static final String COMMENT = "comment";
    public static final String HEADER = "header";
    public static final String IGNORE_LEADING_WHITE_SPACE = "ignoreLeadingWhiteSpace";
    public static final String IGNORE_TRAILING_WHITE_SPACE = "ignoreTrailingWhiteSpace";
    public static final String NULL_VALUE = "nullValue";
    public static final String NAN_VALUE = "nanValue";
    public static final String POSITIVE_INF = "positiveInf";
    public static final String NEGATIVE_INF = "negativeInf";
    public static final String DATE_FORMAT = "dateFormat";
    public static final String TIMESTAMP_FORMAT = "timestampFormat";
    public static final String LOCALE = "locale";
    public static final String TIME_ZONE = "timeZone";
    public static final String MODE = "mode";
    public static final String COLUMN_NAME_OF_CORRUPT_RECORD = "columnNameOfCorruptRecord";
    public static final String QUOTE_ALL = "quoteAll";
    public static final String PREFERS_DECIMAL = "prefersDecimal";
    public static final String INFER_DATE = "inferDate";
    public static final String LINE_SEP = "lineSep";

    public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";
    public static final String DEFAULT_TIMESTAMP_WRITE_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX";

    /** Disabled quote, escape or comment character. */
    public static final char NO_CHAR = '\u0000';

    private static final Set<String> KNOWN_OPTIONS = caseInsensitiveSet(
        SEP, DELIMITER, QUOTE, ESCAPE, COMMENT, HEADER, IGNORE_LEADING_WHITE_SPACE,
        IGNORE_TRAILING_WHITE_SPACE, NULL_VALUE, NAN_VALUE, POSITIVE_INF, NEGATIVE_INF,
        DATE_FORMAT, TIMESTAMP_FORMAT, LOCALE, TIME_ZONE, MODE, COLUMN_NAME_OF_CORRUPT_RECORD,
        QUOTE_ALL, PREFERS_DECIMAL, INFER_DATE, LINE_SEP);

    private final Map<String, String> parameters;
    private final boolean columnPruning;

    private final char delimiter;
    private final char quote;
    private final char escape;
    private final char comment;
    private final boolean header;
    private final boolean ignoreLeadingWhiteSpaceInRead;
    private final boolean ignoreTrailingWhiteSpaceInRead;
    private final boolean ignoreLeadingWhiteSpaceInWrite;
    private final boolean ignoreTrailingWhiteSpaceInWrite;
    private final String nullValue;
    private final String nanValue;
    private final String positiveInf;
    private final String negativeInf;
    private final Optional<String> dateFormat;
    private final Optional<String> timestampFormat;
    private final Locale locale;
    private final ZoneId zoneId;
    private final ParseMode parseMode;
    private final String columnNameOfCorruptRecord;
    private final boolean corruptRecordColumnExplicit;
    private final boolean quoteAll;
    private final boolean prefersDecimal;
    private final boolean inferDate;
    private final Optional<String> lineSeparator;

    /**
     * Creates an options bundle, taking the default corrupt-record column name from the
     * active session configuration.
     *
     * @param parameters the user options
     * @param columnPruning whether the parser may skip converting unrequested columns
     * @param defaultTimeZoneId the session time zone, used when no {@code timeZone} option is set;
     *                          may be null when the caller never needs a zone
     */
    public CsvOptions(Map<String, String> parameters, boolean columnPruning, String defaultTimeZoneId) {
        this(parameters, columnPruning, defaultTimeZoneId, SessionConf.active().columnNameOfCorruptRecord());
    }

    /**
     * Creates an options bundle.
     *
     * @param parameters the user options
     * @param columnPruning whether the parser may skip converting unrequested columns
     * @param defaultTimeZoneId the session time zone, may be null
     * @param defaultColumnNameOfCorruptRecord the corrupt-record column used when the option is absent
     */
    public CsvOptions(Map<String, String> parameters, boolean columnPruning, String defaultTimeZoneId,
                      String defaultColumnNameOfCorruptRecord) {
        Map<String, String> params = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        params.putAll(parameters);
        this.parameters = Collections.unmodifiableMap(params);
        this.columnPruning = columnPruning;

        for (String key : params.keySet()) {
            if (!KNOWN_OPTIONS.contains(key)) {
                logger.debug("Ignoring unrecognized CSV option '{}'", key);
            }
        }

        String sep = params.containsKey(SEP) ? params.get(SEP) : params.getOrDefault(DELIMITER, ",");
        this.delimiter = toDelimiterChar(sep);
        this.quote = getChar(QUOTE, '"');
        this.escape = getChar(ESCAPE, '\\');
        this.comment = getChar(COMMENT, NO_CHAR);
        this.header = getBool(HEADER, false);
        this.ignoreLeadingWhiteSpaceInRead = getBool(IGNORE_LEADING_WHITE_SPACE, false);
        this.ignoreTrailingWhiteSpaceInRead = getBool(IGNORE_TRAILING_WHITE_SPACE, false);
        this.ignoreLeadingWhiteSpaceInWrite = getBool(IGNORE_LEADING_WHITE_SPACE, true);
        this.ignoreTrailingWhiteSpaceInWrite = getBool(IGNORE_TRAILING_WHITE_SPACE, true);
        this.nullValue = params.getOrDefault(NULL_VALUE, "");
        this.nanValue = params.getOrDefault(NAN_VALUE, "NaN");
        this.positiveInf = params.getOrDefault(POSITIVE_INF, "Inf");
        this.negativeInf = params.getOrDefault(NEGATIVE_INF, "-Inf");
        this.dateFormat = Optional.ofNullable(params.get(DATE_FORMAT));
        this.timestampFormat = Optional.ofNullable(params.get(TIMESTAMP_FORMAT));
        this.locale = Locale.forLanguageTag(params.getOrDefault(LOCALE, "en-US"));
        checkPattern(DATE_FORMAT, dateFormat, locale);
        checkPattern(TIMESTAMP_FORMAT, timestampFormat, locale);
        this.zoneId = resolveZone(params.getOrDefault(TIME_ZONE, defaultTimeZoneId));
        this.quoteAll = getBool(QUOTE_ALL, false);
        this.prefersDecimal = getBool(PREFERS_DECIMAL, false);
        this.inferDate = getBool(INFER_DATE, false);

        try {
            this.parseMode = ParseMode.fromString(params.get(MODE));
        } catch (IllegalArgumentException e) {
            throw invalidValue(MODE, params.get(MODE), e.getMessage());
        }

        this.corruptRecordColumnExplicit = params.containsKey(COLUMN_NAME_OF_CORRUPT_RECORD);
        this.columnNameOfCorruptRecord = corruptRecordColumnExplicit
            ? params.get(COLUMN_NAME_OF_CORRUPT_RECORD)
            : defaultColumnNameOfCorruptRecord;

        String lineSep = params.get(LINE_SEP);
        if (lineSep != null && lineSep.isEmpty()) {
            throw invalidValue(LINE_SEP, lineSep, "'lineSep' cannot be an empty string");
        }
        this.lineSeparator = Optional.ofNullable(lineSep);

        if (quote != NO_CHAR && quote == delimiter) {
            throw invalidValue(QUOTE, String.valueOf(quote), "Quote character must differ from the delimiter");
        }
        if (escape != NO_CHAR && escape == delimiter) {
            throw invalidValue(ESCAPE, String.valueOf(escape), "Escape character must differ from the delimiter");
        }
    }

    /**
     * Returns a copy of these options with one more option set.
     *
     * @param key the option name
     * @param value the option value
     * @param defaultTimeZoneId the session time zone, may be null
     * @param defaultColumnNameOfCorruptRecord the fallback corrupt-record column name
     * @return the new options
     */
    public CsvOptions with(String key, String value, String defaultTimeZoneId,
                           String defaultColumnNameOfCorruptRecord) {
        Map<String, String> copy = new HashMap<>(parameters);
        copy.keySet().removeIf(k -> k.equalsIgnoreCase(key));
        copy.put(key, value);
        return new CsvOptions(copy, columnPruning, defaultTimeZoneId, defaultColumnNameOfCorruptRecord);
    }

    /**
     * Builds a fresh tokenizer configured from these options.
     *
     * <p>When the quote and escape characters coincide, quotes are escaped by
     * doubling them as in RFC 4180.
     *
     * @return a new tokenizer
     */
    public CsvTokenizer newTokenizer() {
        if (quote != NO_CHAR && quote == escape) {
            ICSVParser rfc4180 = new RFC4180ParserBuilder()
                .withSeparator(delimiter)
                .withQuoteChar(quote)
                .build();
            return new CsvTokenizer(rfc4180, quote, NO_CHAR);
        }
        ICSVParser parser = new CSVParserBuilder()
            .withSeparator(delimiter)
            .withQuoteChar(quote == NO_CHAR ? ICSVParser.NULL_CHARACTER : quote)
            .withEscapeChar(escape == NO_CHAR ? ICSVParser.NULL_CHARACTER : CsvTokenizer.ESCAPE_SENTINEL)
            .withIgnoreQuotations(quote == NO_CHAR)
            .withIgnoreLeadingWhiteSpace(ignoreLeadingWhiteSpaceInRead)
            .withStrictQuotes(false)
            .build();
        return new CsvTokenizer(parser, quote, escape);
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    public boolean columnPruning() {
        return columnPruning;
    }

    public char delimiter() {
        return delimiter;
    }

    public char quote() {
        return quote;
    }

    public char escape() {
        return escape;
    }

    public char comment() {
        return comment;
    }

    public boolean isCommentSet() {
        return comment != NO_CHAR;
    }

    public boolean header() {
        return header;
    }

    public boolean ignoreLeadingWhiteSpaceInRead() {
        return ignoreLeadingWhiteSpaceInRead;
    }

    public boolean ignoreTrailingWhiteSpaceInRead() {
        return ignoreTrailingWhiteSpaceInRead;
    }

    public boolean ignoreLeadingWhiteSpaceInWrite() {
        return ignoreLeadingWhiteSpaceInWrite;
    }

    public boolean ignoreTrailingWhiteSpaceInWrite() {
        return ignoreTrailingWhiteSpaceInWrite;
    }

    public String nullValue() {
        return nullValue;
    }

    public String nanValue() {
        return nanValue;
    }

    public String positiveInf() {
        return positiveInf;
    }

    public String negativeInf() {
        return negativeInf;
    }

    public Optional<String> dateFormat() {
        return dateFormat;
    }

    public Optional<String> timestampFormat() {
        return timestampFormat;
    }

    public Locale locale() {
        return locale;
    }

    /**
     * Returns the zone used for timestamp conversion.
     *
     * @return the zone
     * @throws IllegalStateException if neither a {@code timeZone} option nor a session zone was given
     */
    public ZoneId zoneId() {
        if (zoneId == null) {
            throw new IllegalStateException("No time zone: set the 'timeZone' option or bind a session time zone");
        }
        return zoneId;
    }

    public ParseMode parseMode() {
        return parseMode;
    }

    public String columnNameOfCorruptRecord() {
        return columnNameOfCorruptRecord;
    }

    /**
     * Returns whether the corrupt-record column name came from the
     * {@code columnNameOfCorruptRecord} option rather than the session default.
     *
     * @return true if the option was set
     */
    public boolean corruptRecordColumnExplicit() {
        return corruptRecordColumnExplicit;
    }

    public boolean quoteAll() {
        return quoteAll;
    }

    public boolean prefersDecimal() {
        return prefersDecimal;
    }

    public boolean inferDate() {
        return inferDate;
    }

    public Optional<String> lineSeparator() {
        return lineSeparator;
    }

    @Override
    public String toString() {
        return "CsvOptions" + parameters;
    }

    private char getChar(String key, char defaultValue) {
        String value = parameters.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value.isEmpty()) {
            return NO_CHAR;
        }
        if (value.length() == 1) {
            return value.charAt(0);
        }
        throw invalidValue(key, value, "'" + key + "' cannot be more than one character");
    }

    private boolean getBool(String key, boolean defaultValue) {
        String value = parameters.get(key);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        throw invalidValue(key, value, "'" + key + "' must be true or false");
    }

    private static void checkPattern(String key, Optional<String> pattern, Locale locale) {
        if (pattern.isEmpty()) {
            return;
        }
        try {
            DateTimeFormatter.ofPattern(pattern.get(), locale);
        } catch (IllegalArgumentException e) {
            throw invalidValue(key, pattern.get(), "Invalid datetime pattern for '" + key + "': " + e.getMessage());
        }
    }

    private static ZoneId resolveZone(String id) {
        if (id == null) {
            return null;
        }
        try {
            return ZoneId.of(id, ZoneId.SHORT_IDS);
        } catch (DateTimeException e) {
            throw invalidValue(TIME_ZONE, id, "Invalid time zone id: " + e.getMessage());
        }
    }

    /**
     * Interprets a delimiter string: a single character, a tab written as a
     * backslash-t escape, or a backslash-u unicode escape.
     */
    static char toDelimiterChar(String str) {
        if (str == null || str.isEmpty()) {
            throw invalidValue(SEP, str, "Delimiter cannot be empty");
        }
        if (str.length() == 1) {
            return str.charAt(0);
        }
        if (str.equals("\\t")) {
            return '\t';
        }
        if (str.equals("\\\\")) {
            return '\\';
        }
        if (str.length() == 6 && str.startsWith("\\u")) {
            try {
                return (char) Integer.parseInt(str.substring(2), 16);
            } catch (NumberFormatException e) {
                throw invalidValue(SEP, str, "Unsupported special character for delimiter: " + str);
            }
        }
        if (str.startsWith("\\")) {
            throw invalidValue(SEP, str, "Unsupported special character for delimiter: " + str);
        }
        throw invalidValue(SEP, str, "Delimiter cannot be more than one character: " + str);
    }

    private static AnalysisException invalidValue(String key, String value, String reason) {
        Map<String, String> params = new HashMap<>();
        params.put("option", key);
        params.put("value", String.valueOf(value));
        return new AnalysisException("INVALID_OPTION_VALUE", reason, params);
    }

    private static Set<String> caseInsensitiveSet(String... names) {
        Set<String> set = Collections.newSetFromMap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));
        Collections.addAll(set, names);
        return Collections.unmodifiableSet(set);
    }
}
