package com.csvstruct.types;

/**
 * Data type representing a variable-length byte array.
 */
public final class BinaryType implements DataType {

    private static final BinaryType INSTANCE = new BinaryType();

    private BinaryType() {}

    public static BinaryType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "binary";
    }

    @Override
    public String sql() {
        return "BINARY";
    }

    @Override
    public int defaultSize() {
        return -1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BinaryType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
