package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Nullable 16-bit integer.
 */
public final class NullShort extends NullableValue<Short> {
    private static final NullShort EMPTY = new NullShort(null, false);

    private NullShort(Short value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is zero.
     */
    @Contract("_ -> new")
    public static @NotNull NullShort of(@NotNull Short value) {
        return new NullShort(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullShort ofNullable(Short value) {
        return value == null ? EMPTY : new NullShort(value, true);
    }

    public static @NotNull NullShort empty() {
        return EMPTY;
    }
}
