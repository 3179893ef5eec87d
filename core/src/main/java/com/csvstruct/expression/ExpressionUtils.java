package com.csvstruct.expression;

import com.csvstruct.exception.AnalysisException;
import com.csvstruct.types.MapType;
import com.csvstruct.types.NullType;
import com.csvstruct.types.SchemaParser;
import com.csvstruct.types.StringType;
import com.csvstruct.types.StructType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility methods for turning constant argument expressions into the values
 * the CSV functions are configured with.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Evaluates a schema argument, which must be a constant, non-null string in
     * DDL, struct or JSON form.
     *
     * @param exp the schema expression
     * @return the parsed schema
     * @throws AnalysisException {@code INVALID_SCHEMA.NON_STRING_LITERAL} or {@code INVALID_SCHEMA.PARSE_ERROR}
     */
    public static StructType evalSchemaExpr(Expression exp) {
        Object value = exp.foldable() && exp.dataType() instanceof StringType ? exp.eval(null) : null;
        if (value == null) {
            throw new AnalysisException("INVALID_SCHEMA.NON_STRING_LITERAL",
                "The input schema " + exp.toSQL() + " must be a string literal and not null.",
                Map.of("inputSchema", exp.toSQL()));
        }
        try {
            return SchemaParser.parse(value.toString());
        } catch (IllegalArgumentException e) {
            throw new AnalysisException("INVALID_SCHEMA.PARSE_ERROR",
                "The input schema " + exp.toSQL() + " is not a valid schema string: " + e.getMessage(),
                Map.of("inputSchema", exp.toSQL(), "reason", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * Evaluates an options argument, which must be a constant map of strings.
     *
     * @param exp the options expression
     * @return the options, in insertion order
     * @throws AnalysisException {@code INVALID_OPTIONS.NON_MAP_FUNCTION} or {@code INVALID_OPTIONS.NON_STRING_TYPE}
     */
    public static Map<String, String> convertToMapData(Expression exp) {
        if (!(exp instanceof MapLiteralExpression map) || !exp.foldable()) {
            throw new AnalysisException("INVALID_OPTIONS.NON_MAP_FUNCTION",
                "Invalid options: must use the `map()` function for options.",
                Map.of("options", exp.toSQL()));
        }
        MapType type = map.dataType();
        if (!isStringOrNull(type)) {
            throw new AnalysisException("INVALID_OPTIONS.NON_STRING_TYPE",
                "Invalid options: a type of keys and values in `map()` must be string, but got " + type.sql() + ".",
                Map.of("mapType", type.sql()));
        }
        Map<String, String> options = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : map.eval(null).entrySet()) {
            if (entry.getValue() == null) {
                throw new AnalysisException("INVALID_OPTIONS.NON_STRING_TYPE",
                    "Invalid options: option '" + entry.getKey() + "' has a null value.",
                    Map.of("mapType", type.sql()));
            }
            options.put(entry.getKey().toString(), entry.getValue().toString());
        }
        return options;
    }

    /**
     * Renders an options map as a {@code map(...)} SQL fragment.
     *
     * @param options the options
     * @return the SQL fragment
     */
    public static String optionsToSQL(Map<String, String> options) {
        return options.entrySet().stream()
            .map(e -> Literal.of(e.getKey()).toSQL() + ", " + Literal.of(e.getValue()).toSQL())
            .collect(Collectors.joining(", ", "map(", ")"));
    }

    private static boolean isStringOrNull(MapType type) {
        return (type.keyType() instanceof StringType || type.keyType() instanceof NullType)
            && (type.valueType() instanceof StringType || type.valueType() instanceof NullType);
    }
}
