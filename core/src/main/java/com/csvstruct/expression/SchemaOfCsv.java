package com.csvstruct.expression;

import com.csvstruct.config.SessionConf;
import com.csvstruct.csv.CsvOptions;
import com.csvstruct.csv.SchemaOfCsvEvaluator;
import com.csvstruct.exception.SchemaInferenceException;
import com.csvstruct.row.Row;
import com.csvstruct.types.StringType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Infers the schema of a constant CSV sample: {@code schema_of_csv(csv[, options])}.
 *
 * <p>Example:
 * <pre>
 *   schema_of_csv('1,abc')   -- STRUCT&lt;_c0: INT, _c1: STRING&gt;
 * </pre>
 */
public final class SchemaOfCsv implements Expression, TypeChecked {

    private final Expression child;
    private final Map<String, String> options;
    private final LazySlot<SchemaOfCsvEvaluator> evaluator;

    /**
     * Creates the expression.
     *
     * @param child the sample expression; must be a foldable, non-null string
     * @param options the CSV options
     * @throws com.csvstruct.exception.AnalysisException if an option value is invalid
     */
    public SchemaOfCsv(Expression child, Map<String, String> options) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(options, "options must not be null")));
        CsvOptions parsedOptions = new CsvOptions(options, true, SessionConf.active().sessionTimeZone());
        this.evaluator = new LazySlot<>(() -> new SchemaOfCsvEvaluator(parsedOptions));
    }

    public SchemaOfCsv(Expression child) {
        this(child, Collections.emptyMap());
    }

    public Expression child() {
        return child;
    }

    public Map<String, String> options() {
        return options;
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public StringType dataType() {
        return StringType.get();
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public boolean foldable() {
        return child.foldable();
    }

    @Override
    public TypeCheckResult checkInputDataTypes() {
        if (!child.foldable()) {
            return new TypeCheckResult.DataTypeMismatch("NON_FOLDABLE_INPUT", Map.of(
                "inputName", "`csv`",
                "inputType", "\"STRING\"",
                "inputExpr", "\"" + child.toSQL() + "\""));
        }
        if (child.eval(null) == null) {
            return new TypeCheckResult.DataTypeMismatch("UNEXPECTED_NULL", Map.of("exprName", "csv"));
        }
        if (!(child.dataType() instanceof StringType)) {
            return new TypeCheckResult.DataTypeMismatch("UNEXPECTED_INPUT_TYPE", Map.of(
                "paramIndex", "first",
                "requiredType", "\"STRING\"",
                "inputSql", "\"" + child.toSQL() + "\"",
                "inputType", "\"" + child.dataType().sql() + "\""));
        }
        return TypeCheckResult.SUCCESS;
    }

    /**
     * Infers the schema of the sample.
     *
     * @param input the input row, unused for foldable samples
     * @return the schema in DDL form
     * @throws SchemaInferenceException if the sample is null or holds no record
     */
    @Override
    public String eval(Row input) {
        Object csv = child.eval(input);
        if (csv == null) {
            throw new SchemaInferenceException("schema_of_csv requires a non-null CSV sample");
        }
        return evaluator.get().evaluate(csv.toString());
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder("schema_of_csv(").append(child.toSQL());
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
        if (!(obj instanceof SchemaOfCsv)) return false;
        SchemaOfCsv that = (SchemaOfCsv) obj;
        return Objects.equals(child, that.child) &&
               Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, options);
    }
}
