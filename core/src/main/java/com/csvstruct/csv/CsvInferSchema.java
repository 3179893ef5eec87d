package com.csvstruct.csv;

import com.csvstruct.types.BooleanType;
import com.csvstruct.types.DataType;
import com.csvstruct.types.DateType;
import com.csvstruct.types.DecimalType;
import com.csvstruct.types.DoubleType;
import com.csvstruct.types.IntegerType;
import com.csvstruct.types.LongType;
import com.csvstruct.types.NullType;
import com.csvstruct.types.StringType;
import com.csvstruct.types.StructField;
import com.csvstruct.types.StructType;
import com.csvstruct.types.TimestampType;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Infers column types from CSV tokens.
 *
 * <p>Each token is tried against progressively wider types, starting from the type
 * inferred so far for its column:
 * <pre>
 *   null → int → long → decimal (prefersDecimal) → double → date (inferDate)
 *        → timestamp → boolean → string
 * </pre>
 * Tokens equal to {@code nullValue} leave the column type unchanged. A column that
 * only ever saw null tokens is reported as string.
 */
public class CsvInferSchema {

    private final CsvOptions options;
    private final TemporalFormatters temporal;

    public CsvInferSchema(CsvOptions options) {
        this.options = options;
        this.temporal = new TemporalFormatters(options);
    }

    /**
     * Returns the starting column types for a record of the given width.
     */
    public DataType[] startType(int width) {
        DataType[] types = new DataType[width];
        Arrays.fill(types, NullType.get());
        return types;
    }

    /**
     * Folds one record's tokens into the column types inferred so far. Columns the
     * record does not have keep their type; a wider record widens the result.
     *
     * @param rowSoFar the types inferred so far
     * @param tokens the record's tokens
     * @return the merged types
     */
    public DataType[] inferRowType(DataType[] rowSoFar, String[] tokens) {
        DataType[] result = Arrays.copyOf(rowSoFar, Math.max(rowSoFar.length, tokens.length));
        for (int i = 0; i < result.length; i++) {
            DataType soFar = result[i] == null ? NullType.get() : result[i];
            if (i < tokens.length) {
                DataType inferred = inferField(soFar, tokens[i]);
                result[i] = compatibleType(soFar, inferred).orElse(StringType.get());
            } else {
                result[i] = soFar;
            }
        }
        return result;
    }

    /**
     * Builds the schema for the given column types, naming fields {@code _c0}, {@code _c1}, ...
     *
     * @param types the inferred column types
     * @return the schema, every field nullable
     */
    public StructType toStructType(DataType[] types) {
        List<StructField> fields = new ArrayList<>(types.length);
        for (int i = 0; i < types.length; i++) {
            DataType type = types[i] instanceof NullType ? StringType.get() : types[i];
            fields.add(new StructField("_c" + i, type, true));
        }
        return new StructType(fields);
    }

    /**
     * Infers the type of one token given the column type so far.
     *
     * @param typeSoFar the type inferred so far
     * @param field the token, may be null
     * @return the inferred type
     */
    public DataType inferField(DataType typeSoFar, String field) {
        if (field == null || field.isEmpty() || field.equals(options.nullValue())) {
            return typeSoFar;
        }
        if (typeSoFar instanceof NullType || typeSoFar instanceof IntegerType) {
            return tryParseInteger(field);
        }
        if (typeSoFar instanceof LongType) {
            return tryParseLong(field);
        }
        if (typeSoFar instanceof DecimalType) {
            return tryParseDecimal(field);
        }
        if (typeSoFar instanceof DoubleType) {
            return tryParseDouble(field);
        }
        if (typeSoFar instanceof DateType) {
            return tryParseDate(field);
        }
        if (typeSoFar instanceof TimestampType) {
            return tryParseTimestamp(field);
        }
        if (typeSoFar instanceof BooleanType) {
            return tryParseBoolean(field);
        }
        if (typeSoFar instanceof StringType) {
            return StringType.get();
        }
        throw new IllegalArgumentException("Unexpected data type " + typeSoFar.sql() + " during CSV inference");
    }

    private DataType tryParseInteger(String field) {
        try {
            Integer.parseInt(field.trim());
            return IntegerType.get();
        } catch (NumberFormatException e) {
            return tryParseLong(field);
        }
    }

    private DataType tryParseLong(String field) {
        try {
            Long.parseLong(field.trim());
            return LongType.get();
        } catch (NumberFormatException e) {
            return tryParseDecimal(field);
        }
    }

    private DataType tryParseDecimal(String field) {
        if (!options.prefersDecimal()) {
            return tryParseDouble(field);
        }
        try {
            BigDecimal decimal = new BigDecimal(field.trim());
            int scale = Math.max(decimal.scale(), 0);
            int precision = decimal.scale() < 0
                ? decimal.precision() - decimal.scale()
                : Math.max(decimal.precision(), scale);
            if (precision > DecimalType.MAX_PRECISION) {
                return tryParseDouble(field);
            }
            return new DecimalType(precision, scale);
        } catch (NumberFormatException e) {
            return tryParseDouble(field);
        }
    }

    private DataType tryParseDouble(String field) {
        if (isInfOrNan(field)) {
            return DoubleType.get();
        }
        try {
            Double.parseDouble(field.trim());
            return DoubleType.get();
        } catch (NumberFormatException e) {
            return options.inferDate() ? tryParseDate(field) : tryParseTimestamp(field);
        }
    }

    private DataType tryParseDate(String field) {
        try {
            temporal.parseDate(field.trim());
            return DateType.get();
        } catch (DateTimeException e) {
            return tryParseTimestamp(field);
        }
    }

    private DataType tryParseTimestamp(String field) {
        try {
            temporal.parseTimestamp(field.trim());
            return TimestampType.get();
        } catch (DateTimeException e) {
            return tryParseBoolean(field);
        }
    }

    private DataType tryParseBoolean(String field) {
        String trimmed = field.trim();
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
            return BooleanType.get();
        }
        return StringType.get();
    }

    private boolean isInfOrNan(String field) {
        return field.equals(options.nanValue())
            || field.equals(options.positiveInf())
            || field.equals(options.negativeInf());
    }

    /**
     * Returns the narrowest type both inputs widen to, or empty when only string fits.
     *
     * @param t1 one type
     * @param t2 another type
     * @return the common type, if any
     */
    public static Optional<DataType> compatibleType(DataType t1, DataType t2) {
        if (t1.equals(t2)) {
            return Optional.of(t1);
        }
        if (t1 instanceof NullType) {
            return Optional.of(t2);
        }
        if (t2 instanceof NullType) {
            return Optional.of(t1);
        }
        if (t1 instanceof StringType || t2 instanceof StringType) {
            return Optional.of(StringType.get());
        }
        if (isIntegral(t1) && isIntegral(t2)) {
            return Optional.of(LongType.get());
        }
        if (t1 instanceof DoubleType && isNumeric(t2) || t2 instanceof DoubleType && isNumeric(t1)) {
            return Optional.of(DoubleType.get());
        }
        if (t1 instanceof DecimalType d1 && t2 instanceof DecimalType d2) {
            return Optional.of(widerDecimal(d1, d2));
        }
        if (t1 instanceof DecimalType d1 && isIntegral(t2)) {
            return Optional.of(widerDecimal(d1, integralDecimal(t2)));
        }
        if (t2 instanceof DecimalType d2 && isIntegral(t1)) {
            return Optional.of(widerDecimal(integralDecimal(t1), d2));
        }
        if (t1 instanceof DateType && t2 instanceof TimestampType
            || t1 instanceof TimestampType && t2 instanceof DateType) {
            return Optional.of(TimestampType.get());
        }
        return Optional.empty();
    }

    private static DataType widerDecimal(DecimalType d1, DecimalType d2) {
        int scale = Math.max(d1.scale(), d2.scale());
        int range = Math.max(d1.precision() - d1.scale(), d2.precision() - d2.scale());
        if (range + scale > DecimalType.MAX_PRECISION) {
            return DoubleType.get();
        }
        return new DecimalType(range + scale, scale);
    }

    private static DecimalType integralDecimal(DataType type) {
        return type instanceof IntegerType ? new DecimalType(10, 0) : new DecimalType(20, 0);
    }

    private static boolean isIntegral(DataType type) {
        return type instanceof IntegerType || type instanceof LongType;
    }

    private static boolean isNumeric(DataType type) {
        return isIntegral(type) || type instanceof DoubleType || type instanceof DecimalType;
    }
}
