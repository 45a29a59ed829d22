package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Nullable boolean; {@code false} is a present value.
 */
public final class NullBoolean extends NullableValue<Boolean> {
    private static final NullBoolean EMPTY = new NullBoolean(null, false);

    private NullBoolean(Boolean value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is false.
     */
    @Contract("_ -> new")
    public static @NotNull NullBoolean of(@NotNull Boolean value) {
        return new NullBoolean(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullBoolean ofNullable(Boolean value) {
        return value == null ? EMPTY : new NullBoolean(value, true);
    }

    public static @NotNull NullBoolean empty() {
        return EMPTY;
    }
}
