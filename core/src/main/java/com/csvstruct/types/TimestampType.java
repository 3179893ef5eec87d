package com.csvstruct.types;

/**
 * Data type representing an instant on the time line with microsecond precision.
 *
 * <p>Values are carried as {@link java.time.Instant}. Text conversion is time zone
 * sensitive: parsing a timestamp without an explicit offset interprets it in the
 * session (or option) time zone, and formatting renders the instant in that zone.
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp";
    }

    @Override
    public String sql() {
        return "TIMESTAMP";
    }

    @Override
    public int defaultSize() {
        return 8; // microseconds since epoch
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
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
