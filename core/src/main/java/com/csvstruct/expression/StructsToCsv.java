package com.csvstruct.expression;

import com.csvstruct.csv.CsvOptions;
import com.csvstruct.csv.CsvRecordWriter;
import com.csvstruct.csv.CsvTypeSupport;
import com.csvstruct.row.Row;
import com.csvstruct.types.StringType;
import com.csvstruct.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.CharArrayWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts a struct value into a CSV string: {@code to_csv(struct[, options])}.
 *
 * <p>Example:
 * <pre>
 *   to_csv(named_struct('a', 1, 'b', 2))   -- 1,2
 * </pre>
 */
public final class StructsToCsv implements Expression, TypeChecked, TimeZoneAware, CodeGenerable {

    private static final Logger logger = LoggerFactory.getLogger(StructsToCsv.class);

    private final Map<String, String> options;
    private final Expression child;
    private final String timeZoneId;

    private final CsvOptions parsedOptions;
    private final LazySlot<CsvRecordWriter> writer;

    public StructsToCsv(Map<String, String> options, Expression child) {
        this(options, child, null);
    }

    /**
     * Creates an encoder.
     *
     * @param options the CSV options
     * @param child the expression producing the struct
     * @param timeZoneId the session time zone, or null if not yet bound
     * @throws com.csvstruct.exception.AnalysisException if an option value is invalid
     */
    public StructsToCsv(Map<String, String> options, Expression child, String timeZoneId) {
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(options, "options must not be null")));
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.timeZoneId = timeZoneId;
        this.parsedOptions = new CsvOptions(options, true, timeZoneId);
        this.writer = new LazySlot<>(() -> {
            StructType schema = (StructType) child.dataType();
            logger.debug("Initializing to_csv writer for schema {}", schema.sql());
            return new CsvRecordWriter(schema, new CharArrayWriter(), parsedOptions);
        });
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
    public Optional<String> timeZoneId() {
        return Optional.ofNullable(timeZoneId);
    }

    @Override
    public StructsToCsv withTimeZone(String timeZoneId) {
        return new StructsToCsv(options, child, timeZoneId);
    }

    @Override
    public StringType dataType() {
        return StringType.get();
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public boolean foldable() {
        return child.foldable();
    }

    @Override
    public TypeCheckResult checkInputDataTypes() {
        if (child.dataType() instanceof StructType struct && CsvTypeSupport.isSupported(struct)) {
            return TypeCheckResult.SUCCESS;
        }
        return new TypeCheckResult.DataTypeMismatch("UNSUPPORTED_INPUT_TYPE", Map.of(
            "functionName", "`to_csv`",
            "dataType", "\"" + child.dataType().sql() + "\""));
    }

    /**
     * Encodes the child's struct value.
     *
     * @param input the input row
     * @return the CSV text, or null when the child evaluates to null
     * @throws IllegalStateException if no time zone is bound
     */
    @Override
    public String eval(Row input) {
        return convert(child.eval(input));
    }

    /**
     * Compiles this expression. The compiled evaluator shares this instance's writer,
     * so it must be driven by the same task.
     */
    @Override
    public CompiledExpression compile() {
        CompiledExpression childEvaluator = CompiledExpression.of(child);
        return input -> convert(childEvaluator.evaluate(input));
    }

    private String convert(Object value) {
        if (!timeZoneResolved()) {
            throw new IllegalStateException("to_csv must be bound to a time zone before evaluation");
        }
        if (value == null) {
            return null;
        }
        return writer.get().writeToString((Row) value);
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder("to_csv(").append(child.toSQL());
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
        if (!(obj instanceof StructsToCsv)) return false;
        StructsToCsv that = (StructsToCsv) obj;
        return Objects.equals(options, that.options) &&
               Objects.equals(child, that.child) &&
               Objects.equals(timeZoneId, that.timeZoneId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(options, child, timeZoneId);
    }
}
