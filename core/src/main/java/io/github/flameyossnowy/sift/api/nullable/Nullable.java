package io.github.flameyossnowy.sift.api.nullable;

/**
 * A value that distinguishes "not supplied" from "supplied", independently of whether the
 * supplied value is zero, empty or false.
 *
 * @param <T> the wrapped value type
 */
public interface Nullable<T> {
    /**
     * Whether a value was supplied. A present wrapper may still hold a zero value.
     */
    boolean isPresent();

    /**
     * The supplied value, or {@code null} when {@link #isPresent()} is false.
     */
    T get();

    default T orElse(T other) {
        return isPresent() ? get() : other;
    }
}
