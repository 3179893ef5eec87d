package com.csvstruct.expression;

import com.csvstruct.config.SessionConf;
import com.csvstruct.csv.CsvOptions;
import com.csvstruct.csv.CsvRecordParser;
import com.csvstruct.csv.FailureSafeParser;
import com.csvstruct.csv.ParseMode;
import com.csvstruct.csv.ResolvedSchema;
import com.csvstruct.csv.SchemaResolver;
import com.csvstruct.exception.AnalysisException;
import com.csvstruct.exception.InternalCodecException;
import com.csvstruct.row.Row;
import com.csvstruct.types.StringType;
import com.csvstruct.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts a CSV string into a row of the given schema: {@code from_csv(csv, schema[, options])}.
 *
 * <p>The whole input string is one record: the line separator is replaced by a
 * character that cannot occur in text, so embedded line breaks are ordinary
 * characters. Records that fail to parse are handled by the {@code mode} option:
 * {@code PERMISSIVE} (default) returns a row of nulls, with the input text in the
 * corrupt-record column when the schema has one, and {@code FAILFAST} throws
 * {@link com.csvstruct.exception.MalformedRecordException}.
 *
 * <p>Options, parse mode, corrupt-record column and schema types are validated
 * when the expression is constructed. The parser itself is created on first
 * evaluation and reused.
 *
 * <p>Example:
 * <pre>
 *   from_csv('1, 0.8', 'a INT, b DOUBLE')   -- {"a":1,"b":0.8}
 * </pre>
 */
public final class CsvToStructs implements Expression, TypeChecked, TimeZoneAware, SchemaBound {

    private static final Logger logger = LoggerFactory.getLogger(CsvToStructs.class);

    /** A Unicode noncharacter used as line separator so the input is never split. */
    static final String LINE_SEPARATOR_SENTINEL = "\uFFFF";

    private final StructType schema;
    private final Map<String, String> options;
    private final Expression child;
    private final String timeZoneId;
    private final StructType requiredSchema;

    private final CsvOptions parsedOptions;
    private final ResolvedSchema resolved;
    private final LazySlot<FailureSafeParser> parser;

    /**
     * Creates an unbound decoder.
     *
     * @param schema the declared schema
     * @param options the CSV options
     * @param child the expression producing the CSV text
     * @throws AnalysisException if the options, mode, corrupt-record column or schema are invalid
     */
    public CsvToStructs(StructType schema, Map<String, String> options, Expression child) {
        this(schema, options, child, null, null);
    }

    /**
     * Creates a decoder.
     *
     * @param schema the declared schema
     * @param options the CSV options
     * @param child the expression producing the CSV text
     * @param timeZoneId the session time zone, or null if not yet bound
     * @param requiredSchema the fields to produce, or null for all declared fields
     * @throws AnalysisException if the options, mode, corrupt-record column or schema are invalid
     */
    public CsvToStructs(StructType schema, Map<String, String> options, Expression child,
                        String timeZoneId, StructType requiredSchema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(options, "options must not be null")));
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.timeZoneId = timeZoneId;
        this.requiredSchema = requiredSchema;

        Map<String, String> withSentinel = new LinkedHashMap<>(options);
        withSentinel.keySet().removeIf(key -> key.equalsIgnoreCase(CsvOptions.LINE_SEP));
        withSentinel.put(CsvOptions.LINE_SEP, LINE_SEPARATOR_SENTINEL);
        this.parsedOptions = new CsvOptions(withSentinel, true, timeZoneId,
            SessionConf.active().columnNameOfCorruptRecord());

        ParseMode mode = parsedOptions.parseMode();
        if (mode != ParseMode.PERMISSIVE && mode != ParseMode.FAIL_FAST) {
            throw new AnalysisException("PARSE_MODE_UNSUPPORTED",
                "The function `from_csv` doesn't support the " + mode.optionName()
                    + " mode. Acceptable modes are PERMISSIVE and FAILFAST.",
                Map.of("funcName", "`from_csv`", "mode", mode.optionName()));
        }

        this.resolved = SchemaResolver.resolve(schema, requiredSchema,
            parsedOptions.columnNameOfCorruptRecord(), parsedOptions.corruptRecordColumnExplicit());
        CsvRecordParser.verifySchema(resolved.actualSchema());

        this.parser = new LazySlot<>(() -> {
            logger.debug("Initializing from_csv parser for schema {} in {} mode",
                resolved.outputSchema().sql(), mode);
            CsvRecordParser rawParser = new CsvRecordParser(
                resolved.actualSchema(), resolved.actualRequiredSchema(), parsedOptions);
            return new FailureSafeParser(rawParser, mode, resolved);
        });
    }

    public StructType schema() {
        return schema;
    }

    public Map<String, String> options() {
        return options;
    }

    public Expression child() {
        return child;
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public StructType nullableSchema() {
        return resolved.nullableSchema();
    }

    @Override
    public Optional<StructType> requiredSchema() {
        return Optional.ofNullable(requiredSchema);
    }

    @Override
    public CsvToStructs withRequiredSchema(StructType requiredSchema) {
        return new CsvToStructs(schema, options, child, timeZoneId, requiredSchema);
    }

    @Override
    public Optional<String> timeZoneId() {
        return Optional.ofNullable(timeZoneId);
    }

    @Override
    public CsvToStructs withTimeZone(String timeZoneId) {
        return new CsvToStructs(schema, options, child, timeZoneId, requiredSchema);
    }

    @Override
    public StructType dataType() {
        return resolved.outputSchema();
    }

    @Override
    public boolean nullable() {
        return child.nullable();
    }

    @Override
    public boolean foldable() {
        return child.foldable();
    }

    @Override
    public TypeCheckResult checkInputDataTypes() {
        if (child.dataType() instanceof StringType) {
            return TypeCheckResult.SUCCESS;
        }
        return new TypeCheckResult.DataTypeMismatch("UNEXPECTED_INPUT_TYPE", Map.of(
            "paramIndex", "first",
            "requiredType", "\"STRING\"",
            "inputSql", "\"" + child.toSQL() + "\"",
            "inputType", "\"" + child.dataType().sql() + "\""));
    }

    /**
     * Decodes the child's value.
     *
     * @param input the input row
     * @return the decoded row, or null when the child evaluates to null
     * @throws IllegalStateException if no time zone is bound
     * @throws com.csvstruct.exception.MalformedRecordException under FAILFAST for malformed input
     * @throws InternalCodecException if the parser yields more than one record
     */
    @Override
    public Row eval(Row input) {
        if (!timeZoneResolved()) {
            throw new IllegalStateException("from_csv must be bound to a time zone before evaluation");
        }
        Object value = child.eval(input);
        if (value == null) {
            return null;
        }
        return expectSingleRecord(parser.get().parse(value.toString()));
    }

    /**
     * Returns the only row of a single-record parse.
     *
     * @throws InternalCodecException unless exactly one row is given
     */
    static Row expectSingleRecord(List<Row> rows) {
        if (rows.size() == 1) {
            return rows.get(0);
        }
        if (rows.isEmpty()) {
            throw new InternalCodecException("Expected one row from CSV parser, got none");
        }
        throw new InternalCodecException("Expected one row from CSV parser, got " + rows.size());
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder("from_csv(")
            .append(child.toSQL())
            .append(", ")
            .append(Literal.of(schema.toDDL()).toSQL());
        if (!options.isEmpty()) {
            sql.append(", ").append(ExpressionUtils.optionsToSQL(options));
        }
        return sql.append(")").toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CsvToStructs)) return false;
        CsvToStructs that = (CsvToStructs) obj;
        return Objects.equals(schema, that.schema) &&
               Objects.equals(options, that.options) &&
               Objects.equals(child, that.child) &&
               Objects.equals(timeZoneId, that.timeZoneId) &&
               Objects.equals(requiredSchema, that.requiredSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, options, child, timeZoneId, requiredSchema);
    }
}
