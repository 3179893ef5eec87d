package com.csvstruct.types;

import java.util.Objects;

/**
 * Base class for user-defined types.
 *
 * <p>A user-defined type maps a user class onto an underlying physical type
 * ({@link #sqlType()}). Values flow through rows as instances of the user class;
 * codecs convert them with {@link #serialize} and {@link #deserialize} and otherwise
 * treat the column exactly like its underlying type.
 *
 * @param <T> the user class
 */
public abstract non-sealed class UserDefinedType<T> implements DataType {

    /**
     * Returns the underlying physical type.
     *
     * @return the physical type
     */
    public abstract DataType sqlType();

    /**
     * Converts a user object into a value of {@link #sqlType()}.
     *
     * @param obj the user object, never null
     * @return the physical value
     */
    public abstract Object serialize(T obj);

    /**
     * Converts a value of {@link #sqlType()} back into a user object.
     *
     * @param datum the physical value, never null
     * @return the user object
     */
    public abstract T deserialize(Object datum);

    /**
     * Returns the user class.
     *
     * @return the class of values of this type
     */
    public abstract Class<T> userClass();

    /**
     * Serializes an arbitrary object, which must be an instance of {@link #userClass()}.
     *
     * @param obj the user object
     * @return the physical value
     */
    public Object serializeObject(Object obj) {
        return serialize(userClass().cast(obj));
    }

    @Override
    public String typeName() {
        return userClass().getSimpleName().toLowerCase();
    }

    @Override
    public String sql() {
        return sqlType().sql();
    }

    @Override
    public int defaultSize() {
        return sqlType().defaultSize();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Objects.equals(sqlType(), ((UserDefinedType<?>) obj).sqlType());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), sqlType());
    }

    @Override
    public String toString() {
        return typeName();
    }
}
