package com.csvstruct.expression;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Holds a value created on first access and reused afterwards.
 *
 * <p>Not synchronized: a slot belongs to one expression instance, which is
 * driven by one task at a time.
 *
 * @param <T> the value type
 */
public final class LazySlot<T> {

    private final Supplier<T> factory;
    private T value;
    private boolean initialized;

    public LazySlot(Supplier<T> factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    public T get() {
        if (!initialized) {
            value = factory.get();
            initialized = true;
        }
        return value;
    }

    public boolean isInitialized() {
        return initialized;
    }
}
