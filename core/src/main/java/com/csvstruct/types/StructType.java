package com.csvstruct.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Represents a struct type (row schema) with named fields.
 *
 * <p>This is analogous to Spark's StructType. Each field has a name, data type, and
 * nullability flag, and field order is significant: a {@link com.csvstruct.row.Row}
 * is aligned positionally to the fields of its schema.
 */
public final class StructType implements DataType {

    /** Empty struct type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(List<StructField> fields) {
        this.fields = new ArrayList<>(fields);
    }

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Returns the number of fields in this struct.
     *
     * @return the field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public StructField fieldByName(String name) {
        return fields.stream()
            .filter(f -> f.name().equals(name))
            .findFirst()
            .orElse(null);
    }

    /**
     * Returns the index of the field with the given name, or -1 if not found.
     *
     * @param name the field name
     * @return the field index, or -1 if not found
     */
    public int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the field names in order.
     *
     * @return the field names
     */
    public List<String> fieldNames() {
        return fields.stream().map(StructField::name).collect(Collectors.toList());
    }

    /**
     * Returns a copy of this struct without the field of the given name.
     * Returns this struct when no field has that name.
     *
     * @param name the name of the field to drop
     * @return the struct without that field
     */
    public StructType without(String name) {
        if (name == null || fieldIndex(name) < 0) {
            return this;
        }
        List<StructField> kept = new ArrayList<>(fields.size() - 1);
        for (StructField field : fields) {
            if (!field.name().equals(name)) {
                kept.add(field);
            }
        }
        return new StructType(kept);
    }

    /**
     * Returns a copy of this struct in which every field, at every nesting level,
     * accepts nulls.
     *
     * @return the nullable struct
     */
    @Override
    public StructType asNullable() {
        List<StructField> nullable = new ArrayList<>(fields.size());
        for (StructField field : fields) {
            nullable.add(field.asNullable());
        }
        return new StructType(nullable);
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public String sql() {
        return fields.stream()
            .map(StructField::sql)
            .collect(Collectors.joining(", ", "STRUCT<", ">"));
    }

    /**
     * Renders this struct as a top-level DDL column list, e.g. {@code a INT, b STRING}.
     *
     * @return the DDL column list
     */
    public String toDDL() {
        return fields.stream()
            .map(f -> StructField.quoteIfNeeded(f.name()) + " " + f.dataType().sql()
                + (f.nullable() ? "" : " NOT NULL"))
            .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
