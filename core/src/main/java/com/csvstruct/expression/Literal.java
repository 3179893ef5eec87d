package com.csvstruct.expression;

import com.csvstruct.row.Row;
import com.csvstruct.types.BooleanType;
import com.csvstruct.types.DataType;
import com.csvstruct.types.DateType;
import com.csvstruct.types.DoubleType;
import com.csvstruct.types.IntegerType;
import com.csvstruct.types.LongType;
import com.csvstruct.types.StringType;
import com.csvstruct.types.TimestampType;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are fixed values that don't change, such as:
 * <ul>
 *   <li>Numeric literals: 42, 3.14, 100L</li>
 *   <li>String literals: 'a INT, b DOUBLE', '1,abc'</li>
 *   <li>Boolean literals: true, false</li>
 *   <li>Null literal: null</li>
 * </ul>
 *
 * <p>Literals are always foldable.
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public boolean foldable() {
        return true;
    }

    @Override
    public Object eval(Row input) {
        return value;
    }

    /**
     * Converts this literal to its SQL string representation.
     *
     * @return the SQL string
     */
    @Override
    public String toSQL() {
        if (value == null) {
            return "NULL";
        }

        if (dataType instanceof StringType) {
            String str = value.toString().replace("'", "\\'");
            return "'" + str + "'";
        }

        if (dataType instanceof BooleanType) {
            return value.toString().toUpperCase(Locale.ROOT);
        }

        if (dataType instanceof DateType) {
            return "DATE '" + value + "'";
        }

        if (dataType instanceof TimestampType) {
            if (value instanceof Instant instant) {
                LocalDateTime ldt = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
                return "TIMESTAMP '" + ldt.toString().replace("T", " ") + "'";
            }
            return "TIMESTAMP '" + value + "'";
        }

        if (dataType instanceof LongType) {
            return value + "L";
        }

        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    /**
     * Creates a string literal. A null value gives a NULL literal of string type.
     *
     * @param value the string value
     * @return the literal expression
     */
    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the NULL literal expression
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }
}
