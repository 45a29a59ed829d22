package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Nullable floating point number.
 */
public final class NullDouble extends NullableValue<Double> {
    private static final NullDouble EMPTY = new NullDouble(null, false);

    private NullDouble(Double value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is zero.
     */
    @Contract("_ -> new")
    public static @NotNull NullDouble of(@NotNull Double value) {
        return new NullDouble(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullDouble ofNullable(Double value) {
        return value == null ? EMPTY : new NullDouble(value, true);
    }

    public static @NotNull NullDouble empty() {
        return EMPTY;
    }
}
