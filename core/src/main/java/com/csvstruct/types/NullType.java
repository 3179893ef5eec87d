package com.csvstruct.types;

/**
 * The type of a value that is always null.
 *
 * <p>Only appears as the starting point of CSV schema inference; a column whose
 * sampled tokens are all null ends up as {@link StringType}.
 */
public final class NullType implements DataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "void";
    }

    @Override
    public String sql() {
        return "VOID";
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NullType;
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
