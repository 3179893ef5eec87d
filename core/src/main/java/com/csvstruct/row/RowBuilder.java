package com.csvstruct.row;

/**
 * Fills a fixed-width row slot by slot, then hands it out exactly once.
 *
 * <p>The built row takes ownership of the value array without copying it.
 */
public final class RowBuilder {

    private Object[] values;

    public RowBuilder(int size) {
        this.values = new Object[size];
    }

    public RowBuilder set(int ordinal, Object value) {
        values[ordinal] = value;
        return this;
    }

    public int size() {
        return values.length;
    }

    /**
     * Returns the finished row. The builder must not be used afterwards.
     *
     * @return the row
     * @throws IllegalStateException if the row was already built
     */
    public Row build() {
        if (values == null) {
            throw new IllegalStateException("Row already built");
        }
        Row row = Row.wrap(values);
        values = null;
        return row;
    }
}
