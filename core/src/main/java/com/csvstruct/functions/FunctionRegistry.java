package com.csvstruct.functions;

import com.csvstruct.config.SessionConf;
import com.csvstruct.exception.AnalysisException;
import com.csvstruct.expression.CsvToStructs;
import com.csvstruct.expression.Expression;
import com.csvstruct.expression.ExpressionUtils;
import com.csvstruct.expression.SchemaOfCsv;
import com.csvstruct.expression.StructsToCsv;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Registry of the CSV functions, building bound expressions from call arguments.
 *
 * <p>Registered functions:
 * <ul>
 *   <li>{@code from_csv(csv, schema[, options])}</li>
 *   <li>{@code to_csv(struct[, options])}</li>
 *   <li>{@code schema_of_csv(csv[, options])}</li>
 * </ul>
 *
 * <p>Schema arguments must be constant strings and options arguments constant
 * {@code map()} calls of strings. Time zone aware expressions are bound to the
 * active session time zone.
 *
 * <p>Example usage:
 * <pre>
 *   Expression expr = FunctionRegistry.build("from_csv",
 *       List.of(Literal.of("1, 0.8"), Literal.of("a INT, b DOUBLE")));
 *   Row row = (Row) expr.eval(null);   // [1,0.8]
 * </pre>
 */
public class FunctionRegistry {

    private static final Map<String, Function<List<Expression>, Expression>> BUILDERS =
        new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private static final Map<String, ExpressionInfo> FUNCTION_INFO =
        new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    static {
        initializeCsvFunctions();
    }

    private FunctionRegistry() {}

    /**
     * Builds an expression for a function call.
     *
     * @param functionName the function name (case-insensitive)
     * @param arguments the argument expressions
     * @return the bound expression
     * @throws AnalysisException if the function is unknown, the argument count is wrong,
     *         or a constant argument is invalid
     */
    public static Expression build(String functionName, List<Expression> arguments) {
        if (functionName == null || functionName.isEmpty()) {
            throw new IllegalArgumentException("functionName must not be null or empty");
        }
        Function<List<Expression>, Expression> builder = BUILDERS.get(functionName);
        if (builder == null) {
            throw new AnalysisException("UNRESOLVED_ROUTINE",
                "Cannot resolve routine `" + functionName + "`.",
                Map.of("routineName", "`" + functionName + "`"));
        }
        return builder.apply(arguments);
    }

    /**
     * Checks if a function is registered.
     *
     * @param functionName the function name
     * @return true if registered
     */
    public static boolean isSupported(String functionName) {
        return functionName != null && BUILDERS.containsKey(functionName);
    }

    public static Optional<ExpressionInfo> getInfo(String functionName) {
        return functionName == null ? Optional.empty() : Optional.ofNullable(FUNCTION_INFO.get(functionName));
    }

    public static Set<String> functionNames() {
        return Collections.unmodifiableSet(BUILDERS.keySet());
    }

    // ==================== CSV Functions ====================

    private static void initializeCsvFunctions() {
        register("from_csv", args -> {
            checkArity("from_csv", args, 2, 3);
            Map<String, String> options = args.size() == 3
                ? ExpressionUtils.convertToMapData(args.get(2))
                : Collections.emptyMap();
            return new CsvToStructs(ExpressionUtils.evalSchemaExpr(args.get(1)), options, args.get(0),
                SessionConf.active().sessionTimeZone(), null);
        }, new ExpressionInfo(
            "from_csv",
            CsvToStructs.class.getName(),
            "from_csv(csvStr, schema[, options]) - Returns a struct value with the given `csvStr` and `schema`.",
            "csvStr - a string with a CSV record. schema - a constant DDL string. "
                + "options - an optional map of CSV options.",
            "> SELECT from_csv('1, 0.8', 'a INT, b DOUBLE');\n {\"a\":1,\"b\":0.8}",
            "3.0.0",
            "csv_funcs"));

        register("to_csv", args -> {
            checkArity("to_csv", args, 1, 2);
            Map<String, String> options = args.size() == 2
                ? ExpressionUtils.convertToMapData(args.get(1))
                : Collections.emptyMap();
            return new StructsToCsv(options, args.get(0), SessionConf.active().sessionTimeZone());
        }, new ExpressionInfo(
            "to_csv",
            StructsToCsv.class.getName(),
            "to_csv(expr[, options]) - Returns a CSV string with a given struct value.",
            "expr - a struct value. options - an optional map of CSV options.",
            "> SELECT to_csv(named_struct('a', 1, 'b', 2));\n 1,2",
            "3.0.0",
            "csv_funcs"));

        register("schema_of_csv", args -> {
            checkArity("schema_of_csv", args, 1, 2);
            Map<String, String> options = args.size() == 2
                ? ExpressionUtils.convertToMapData(args.get(1))
                : Collections.emptyMap();
            return new SchemaOfCsv(args.get(0), options);
        }, new ExpressionInfo(
            "schema_of_csv",
            SchemaOfCsv.class.getName(),
            "schema_of_csv(csv[, options]) - Returns schema in the DDL format of CSV string.",
            "csv - a constant CSV string. options - an optional map of CSV options.",
            "> SELECT schema_of_csv('1,abc');\n STRUCT<_c0: INT, _c1: STRING>",
            "3.0.0",
            "csv_funcs"));
    }

    private static void register(String name, Function<List<Expression>, Expression> builder,
                                 ExpressionInfo info) {
        BUILDERS.put(name, builder);
        FUNCTION_INFO.put(name, info);
    }

    private static void checkArity(String name, List<Expression> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : "[" + min + ", " + max + "]";
            throw new AnalysisException("WRONG_NUM_ARGS.WITHOUT_SUGGESTION",
                "The `" + name.toLowerCase(Locale.ROOT) + "` requires " + expected
                    + " parameters but the actual number is " + args.size() + ".",
                Map.of("functionName", "`" + name + "`",
                    "expectedNum", expected,
                    "actualNum", String.valueOf(args.size())));
        }
    }
}
