package io.github.flameyossnowy.sift.api.nullable;

import java.util.Objects;

/**
 * Shared state of the nullable wrappers: the value and its validity flag.
 */
public abstract class NullableValue<T> implements Nullable<T> {
    private final T value;
    private final boolean valid;

    protected NullableValue(T value, boolean valid) {
        this.value = valid ? value : null;
        this.valid = valid;
    }

    @Override
    public boolean isPresent() {
        return valid;
    }

    @Override
    public T get() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NullableValue<?> other = (NullableValue<?>) o;
        return valid == other.valid && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value, valid);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + (valid ? "[" + value + "]" : "[null]");
    }
}
