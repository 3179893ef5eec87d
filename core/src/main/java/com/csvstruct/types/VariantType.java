package com.csvstruct.types;

/**
 * Open-ended, self-describing semi-structured type.
 *
 * <p>A variant value carries its own shape, so it has no stable text rendering:
 * variant columns cannot be written as CSV, at any nesting depth.
 */
public final class VariantType implements DataType {

    private static final VariantType INSTANCE = new VariantType();

    private VariantType() {}

    public static VariantType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "variant";
    }

    @Override
    public String sql() {
        return "VARIANT";
    }

    @Override
    public int defaultSize() {
        return 2048;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof VariantType;
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
