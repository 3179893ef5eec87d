package com.csvstruct.types;

import java.util.Objects;

/**
 * Data type representing an array (ordered collection of elements of the same type).
 *
 * <p>Example: {@code ARRAY<INT>} for an array of integers. Values are carried as
 * {@link java.util.List}.
 */
public final class ArrayType implements DataType {

    private final DataType elementType;
    private final boolean containsNull;

    /**
     * Creates an array type with the given element type.
     *
     * @param elementType the type of elements in the array
     * @param containsNull whether the array can contain null elements
     */
    public ArrayType(DataType elementType, boolean containsNull) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
        this.containsNull = containsNull;
    }

    /**
     * Creates an array type that allows null elements.
     *
     * @param elementType the type of elements in the array
     */
    public ArrayType(DataType elementType) {
        this(elementType, true);
    }

    public DataType elementType() {
        return elementType;
    }

    public boolean containsNull() {
        return containsNull;
    }

    @Override
    public String typeName() {
        return "array<" + elementType.typeName() + ">";
    }

    @Override
    public String sql() {
        return "ARRAY<" + elementType.sql() + ">";
    }

    @Override
    public DataType asNullable() {
        return new ArrayType(elementType.asNullable(), true);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) obj;
        return containsNull == that.containsNull &&
               Objects.equals(elementType, that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, containsNull);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
