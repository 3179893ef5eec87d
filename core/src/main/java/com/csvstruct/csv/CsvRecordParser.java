package com.csvstruct.csv;

import com.csvstruct.exception.AnalysisException;
import com.csvstruct.row.Row;
import com.csvstruct.row.RowBuilder;
import com.csvstruct.types.BinaryType;
import com.csvstruct.types.BooleanType;
import com.csvstruct.types.ByteType;
import com.csvstruct.types.DataType;
import com.csvstruct.types.DateType;
import com.csvstruct.types.DecimalType;
import com.csvstruct.types.DoubleType;
import com.csvstruct.types.FloatType;
import com.csvstruct.types.IntegerType;
import com.csvstruct.types.LongType;
import com.csvstruct.types.NullType;
import com.csvstruct.types.ShortType;
import com.csvstruct.types.StringType;
import com.csvstruct.types.StructField;
import com.csvstruct.types.StructType;
import com.csvstruct.types.TimestampType;
import com.csvstruct.types.UserDefinedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses CSV text into rows of a required schema.
 *
 * <p>The input is split into records on the configured line separator (any of
 * {@code \n}, {@code \r\n}, {@code \r} when none is configured), ignoring separators
 * inside quoted fields. Empty records and comment records produce no row. Each
 * remaining record is tokenized by {@link CsvTokenizer} and its tokens are matched by position
 * against the data schema; the required fields are looked up by name, so a required
 * schema may be any subset of the data schema in any order.
 *
 * <p>A record with fewer tokens than the data schema yields nulls for the missing
 * fields, and extra tokens are ignored. A token count mismatch never makes a record
 * malformed, so it passes even under {@code FAILFAST}. A token that cannot be converted to its
 * field type, or an unterminated quoted field, makes the whole record malformed
 * and raises {@link BadRecordException}.
 *
 * <p>Not thread-safe.
 */
public class CsvRecordParser implements RecordParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvRecordParser.class);

    @FunctionalInterface
    private interface ValueConverter {
        Object convert(String datum);
    }

    private final StructType dataSchema;
    private final StructType requiredSchema;
    private final CsvOptions options;
    private final TemporalFormatters temporal;
    private final CsvTokenizer tokenizer;

    /** Position in the data schema of each required field. */
    private final int[] tokenIndexes;
    /** Data schema positions that are converted on every record. */
    private final int[] parsedIndexes;
    private final ValueConverter[] converters;

    /**
     * Creates a parser.
     *
     * @param dataSchema the fields expected in the text, in token order
     * @param requiredSchema the fields to produce, each present in {@code dataSchema}
     * @param options the CSV options
     * @throws AnalysisException {@code UNSUPPORTED_DATA_TYPE} if a data field cannot be decoded
     * @throws IllegalArgumentException if a required field is not in the data schema
     */
    public CsvRecordParser(StructType dataSchema, StructType requiredSchema, CsvOptions options) {
        verifySchema(dataSchema);
        this.dataSchema = dataSchema;
        this.requiredSchema = requiredSchema;
        this.options = options;
        this.temporal = new TemporalFormatters(options);
        this.tokenizer = options.newTokenizer();

        this.tokenIndexes = new int[requiredSchema.size()];
        for (int i = 0; i < requiredSchema.size(); i++) {
            String name = requiredSchema.fieldAt(i).name();
            int index = dataSchema.fieldIndex(name);
            if (index < 0) {
                throw new IllegalArgumentException(
                    "Required field '" + name + "' is not in the data schema " + dataSchema.sql());
            }
            tokenIndexes[i] = index;
        }

        if (options.columnPruning()) {
            this.parsedIndexes = tokenIndexes.clone();
        } else {
            this.parsedIndexes = new int[dataSchema.size()];
            for (int i = 0; i < parsedIndexes.length; i++) {
                parsedIndexes[i] = i;
            }
        }

        this.converters = new ValueConverter[dataSchema.size()];
        for (int index : parsedIndexes) {
            converters[index] = makeConverter(dataSchema.fieldAt(index).dataType());
        }
        logger.debug("Created CSV record parser: data schema {}, required schema {}",
            dataSchema.sql(), requiredSchema.sql());
    }

    /**
     * Checks that every field of the schema can be read from a CSV token.
     *
     * @param schema the schema to check
     * @throws AnalysisException {@code UNSUPPORTED_DATA_TYPE} naming the first unsupported field
     */
    public static void verifySchema(StructType schema) {
        for (StructField field : schema.fields()) {
            if (!CsvTypeSupport.isDecodable(field.dataType())) {
                throw new AnalysisException("UNSUPPORTED_DATA_TYPE",
                    "The CSV datasource doesn't support the column `" + field.name()
                        + "` of the type " + field.dataType().sql() + ".",
                    Map.of("columnName", field.name(), "columnType", field.dataType().sql(), "format", "CSV"));
            }
        }
    }

    public StructType dataSchema() {
        return dataSchema;
    }

    public StructType requiredSchema() {
        return requiredSchema;
    }

    @Override
    public Iterator<Row> parse(String input) throws BadRecordException {
        if (input == null) {
            return Collections.emptyIterator();
        }
        List<Row> rows = new ArrayList<>(1);
        for (String record : splitRecords(input)) {
            if (record.isEmpty() || isComment(record)) {
                continue;
            }
            rows.add(convert(record, tokenize(record)));
        }
        return rows.iterator();
    }

    private boolean isComment(String record) {
        return options.isCommentSet() && record.charAt(0) == options.comment();
    }

    private String[] tokenize(String record) throws BadRecordException {
        String[] tokens;
        try {
            tokens = tokenizer.parseLine(record);
        } catch (IOException e) {
            throw new BadRecordException(record, e);
        }
        if (tokens == null) {
            return new String[0];
        }
        for (int i = 0; i < tokens.length; i++) {
            tokens[i] = trimToken(tokens[i]);
        }
        return tokens;
    }

    private String trimToken(String token) {
        if (token == null) {
            return null;
        }
        String result = token;
        if (options.ignoreLeadingWhiteSpaceInRead()) {
            result = result.stripLeading();
        }
        if (options.ignoreTrailingWhiteSpaceInRead()) {
            result = result.stripTrailing();
        }
        return result;
    }

    private Row convert(String record, String[] tokens) throws BadRecordException {
        Object[] values = new Object[dataSchema.size()];
        for (int index : parsedIndexes) {
            String token = index < tokens.length ? tokens[index] : null;
            if (token == null) {
                continue;
            }
            try {
                values[index] = converters[index].convert(token);
            } catch (DateTimeException | ArithmeticException | IllegalArgumentException e) {
                throw new BadRecordException(record, e);
            }
        }

        RowBuilder row = new RowBuilder(requiredSchema.size());
        for (int i = 0; i < tokenIndexes.length; i++) {
            row.set(i, values[tokenIndexes[i]]);
        }
        return row.build();
    }

    /**
     * Splits the input on the line separator, keeping separators that appear
     * inside quoted fields.
     */
    List<String> splitRecords(String input) {
        String separator = options.lineSeparator().orElse(null);
        char quote = options.quote();
        char escape = options.escape();
        boolean escapes = escape != CsvOptions.NO_CHAR && escape != quote;

        List<String> records = new ArrayList<>(1);
        boolean inQuotes = false;
        int start = 0;
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (escapes && c == escape && i + 1 < input.length()
                && (input.charAt(i + 1) == escape || input.charAt(i + 1) == quote)) {
                i += 2;
                continue;
            }
            if (quote != CsvOptions.NO_CHAR && c == quote) {
                inQuotes = !inQuotes;
                i++;
                continue;
            }
            int separatorLength = inQuotes ? 0 : separatorLengthAt(input, i, separator);
            if (separatorLength > 0) {
                records.add(input.substring(start, i));
                i += separatorLength;
                start = i;
            } else {
                i++;
            }
        }
        records.add(input.substring(start));
        return records;
    }

    private static int separatorLengthAt(String input, int i, String separator) {
        if (separator != null) {
            return input.startsWith(separator, i) ? separator.length() : 0;
        }
        char c = input.charAt(i);
        if (c == '\n') {
            return 1;
        }
        if (c == '\r') {
            return i + 1 < input.length() && input.charAt(i + 1) == '\n' ? 2 : 1;
        }
        return 0;
    }

    private ValueConverter makeConverter(DataType dataType) {
        return nullSafe(baseConverter(dataType));
    }

    private ValueConverter nullSafe(ValueConverter converter) {
        String nullValue = options.nullValue();
        return datum -> datum.equals(nullValue) ? null : converter.convert(datum);
    }

    private ValueConverter baseConverter(DataType dataType) {
        if (dataType instanceof ByteType) {
            return datum -> Byte.valueOf(datum.trim());
        }
        if (dataType instanceof ShortType) {
            return datum -> Short.valueOf(datum.trim());
        }
        if (dataType instanceof IntegerType) {
            return datum -> Integer.valueOf(datum.trim());
        }
        if (dataType instanceof LongType) {
            return datum -> Long.valueOf(datum.trim());
        }
        if (dataType instanceof FloatType) {
            return datum -> {
                if (datum.equals(options.nanValue())) {
                    return Float.NaN;
                } else if (datum.equals(options.positiveInf())) {
                    return Float.POSITIVE_INFINITY;
                } else if (datum.equals(options.negativeInf())) {
                    return Float.NEGATIVE_INFINITY;
                }
                return Float.valueOf(datum.trim());
            };
        }
        if (dataType instanceof DoubleType) {
            return datum -> {
                if (datum.equals(options.nanValue())) {
                    return Double.NaN;
                } else if (datum.equals(options.positiveInf())) {
                    return Double.POSITIVE_INFINITY;
                } else if (datum.equals(options.negativeInf())) {
                    return Double.NEGATIVE_INFINITY;
                }
                return Double.valueOf(datum.trim());
            };
        }
        if (dataType instanceof DecimalType decimal) {
            return datum -> toDecimal(datum.trim(), decimal);
        }
        if (dataType instanceof BooleanType) {
            return datum -> parseBoolean(datum.trim());
        }
        if (dataType instanceof DateType) {
            return datum -> temporal.parseDate(datum.trim());
        }
        if (dataType instanceof TimestampType) {
            return datum -> temporal.parseTimestamp(datum.trim());
        }
        if (dataType instanceof StringType) {
            return datum -> datum;
        }
        if (dataType instanceof BinaryType) {
            return datum -> datum.getBytes(StandardCharsets.UTF_8);
        }
        if (dataType instanceof NullType) {
            return datum -> null;
        }
        if (dataType instanceof UserDefinedType<?> udt) {
            ValueConverter inner = baseConverter(udt.sqlType());
            return datum -> {
                Object value = inner.convert(datum);
                return value == null ? null : udt.deserialize(value);
            };
        }
        throw new IllegalArgumentException("Cannot decode CSV values of type " + dataType.sql());
    }

    /**
     * Converts text to a decimal of the given type, rounding half up to its scale.
     *
     * @throws ArithmeticException if the rounded value needs more digits than the precision allows
     */
    static BigDecimal toDecimal(String text, DecimalType decimal) {
        BigDecimal value = new BigDecimal(text).setScale(decimal.scale(), RoundingMode.HALF_UP);
        if (value.precision() > decimal.precision()) {
            throw new ArithmeticException(
                "Decimal value " + value.toPlainString() + " exceeds precision " + decimal.precision());
        }
        return value;
    }

    /**
     * Parses {@code true} or {@code false}, ignoring case.
     *
     * @throws IllegalArgumentException for any other text
     */
    static Boolean parseBoolean(String text) {
        if (text.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (text.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Cannot parse '" + text + "' as a boolean");
    }
}
