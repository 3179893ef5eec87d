package com.csvstruct.expression;

import com.csvstruct.row.Row;
import com.csvstruct.types.DataType;

import java.util.Objects;

/**
 * Expression reading one column of the input row by position.
 *
 * <p>A column reference is never foldable: its value changes with every input row.
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final int ordinal;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @param ordinal the position of the column in the input row
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     */
    public ColumnReference(String columnName, int ordinal, DataType dataType, boolean nullable) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative: " + ordinal);
        }
        this.ordinal = ordinal;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    public String columnName() {
        return columnName;
    }

    public int ordinal() {
        return ordinal;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public Object eval(Row input) {
        if (input == null) {
            throw new IllegalStateException("Column `" + columnName + "` cannot be evaluated without an input row");
        }
        return input.get(ordinal);
    }

    /**
     * Converts this column reference to SQL, back-quoting names that are not plain identifiers.
     *
     * @return the SQL string
     */
    @Override
    public String toSQL() {
        if (columnName.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            return columnName;
        }
        return "`" + columnName.replace("`", "``") + "`";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return ordinal == that.ordinal &&
               nullable == that.nullable &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, ordinal, dataType, nullable);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a nullable column reference.
     *
     * @param columnName the column name
     * @param ordinal the column position
     * @param dataType the data type
     * @return the column reference
     */
    public static ColumnReference of(String columnName, int ordinal, DataType dataType) {
        return new ColumnReference(columnName, ordinal, dataType, true);
    }
}
