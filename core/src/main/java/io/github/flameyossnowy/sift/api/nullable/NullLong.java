package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Nullable 64-bit integer.
 */
public final class NullLong extends NullableValue<Long> {
    private static final NullLong EMPTY = new NullLong(null, false);

    private NullLong(Long value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is zero.
     */
    @Contract("_ -> new")
    public static @NotNull NullLong of(@NotNull Long value) {
        return new NullLong(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullLong ofNullable(Long value) {
        return value == null ? EMPTY : new NullLong(value, true);
    }

    public static @NotNull NullLong empty() {
        return EMPTY;
    }
}
