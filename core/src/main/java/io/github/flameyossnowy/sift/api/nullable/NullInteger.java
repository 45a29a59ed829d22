package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Nullable 32-bit integer.
 */
public final class NullInteger extends NullableValue<Integer> {
    private static final NullInteger EMPTY = new NullInteger(null, false);

    private NullInteger(Integer value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is zero.
     */
    @Contract("_ -> new")
    public static @NotNull NullInteger of(@NotNull Integer value) {
        return new NullInteger(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullInteger ofNullable(Integer value) {
        return value == null ? EMPTY : new NullInteger(value, true);
    }

    public static @NotNull NullInteger empty() {
        return EMPTY;
    }
}
