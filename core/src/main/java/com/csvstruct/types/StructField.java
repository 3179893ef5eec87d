package com.csvstruct.types;

import java.util.Objects;

/**
 * Represents a field in a StructType.
 *
 * <p>Each field has a name, data type, and nullability flag.
 */
public record StructField(String name, DataType dataType, boolean nullable) {

    /**
     * Creates a struct field.
     *
     * @param name the field name
     * @param dataType the field data type
     * @param nullable whether the field can contain null values
     */
    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a nullable struct field.
     *
     * @param name the field name
     * @param dataType the field data type
     */
    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    /**
     * Returns a copy of this field that accepts nulls, with a nullable data type.
     *
     * @return the nullable field
     */
    public StructField asNullable() {
        return new StructField(name, dataType.asNullable(), true);
    }

    /**
     * Renders this field as a DDL fragment, e.g. {@code a: INT NOT NULL}.
     *
     * @return the DDL fragment
     */
    public String sql() {
        return quoteIfNeeded(name) + ": " + dataType.sql() + (nullable ? "" : " NOT NULL");
    }

    static String quoteIfNeeded(String name) {
        if (name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            return name;
        }
        return "`" + name.replace("`", "``") + "`";
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (nullable ? "" : " NOT NULL");
    }
}
