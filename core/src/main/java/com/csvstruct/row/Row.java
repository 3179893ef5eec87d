package com.csvstruct.row;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered tuple of values aligned positionally to a schema's fields.
 *
 * <p>Values use the Java representation of their data type: boxed primitives,
 * {@link java.math.BigDecimal}, {@link String}, {@code byte[]},
 * {@link java.time.LocalDate}, {@link java.time.Instant}, {@link java.util.List},
 * {@link java.util.Map}, nested {@code Row}s, and user-defined classes.
 *
 * <p>Rows produced by the codecs are never mutated after they are returned.
 * Equality is deep: nested rows, lists and maps compare by value and binary
 * values compare by content.
 */
public final class Row {

    private final Object[] values;

    private Row(Object[] values) {
        this.values = values;
    }

    /**
     * Creates a row holding the given values, in order.
     *
     * @param values the field values (individual values may be null)
     * @return the row
     */
    public static Row of(Object... values) {
        return new Row(values.clone());
    }

    /**
     * Creates a row holding the given values, in order.
     *
     * @param values the field values
     * @return the row
     */
    public static Row fromList(List<?> values) {
        return new Row(values.toArray());
    }

    /**
     * Creates a row of the given width where every value is null.
     *
     * @param size the number of fields
     * @return the all-null row
     */
    public static Row nullRow(int size) {
        return new Row(new Object[size]);
    }

    /**
     * Wraps an array the caller will no longer touch.
     */
    static Row wrap(Object[] values) {
        return new Row(values);
    }

    public int size() {
        return values.length;
    }

    public Object get(int ordinal) {
        return values[ordinal];
    }

    public boolean isNullAt(int ordinal) {
        return values[ordinal] == null;
    }

    /**
     * Returns whether every value in this row is null.
     *
     * @return true for an all-null row
     */
    public boolean allNull() {
        for (Object value : values) {
            if (value != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the values of this row as an unmodifiable list.
     *
     * @return the values
     */
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Row)) return false;
        return Arrays.deepEquals(values, ((Row) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            Object value = values[i];
            sb.append(value instanceof byte[] ? Arrays.toString((byte[]) value) : value);
        }
        return sb.append(']').toString();
    }
}
