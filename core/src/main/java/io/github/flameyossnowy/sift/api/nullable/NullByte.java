package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Nullable byte.
 */
public final class NullByte extends NullableValue<Byte> {
    private static final NullByte EMPTY = new NullByte(null, false);

    private NullByte(Byte value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is zero.
     */
    @Contract("_ -> new")
    public static @NotNull NullByte of(@NotNull Byte value) {
        return new NullByte(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullByte ofNullable(Byte value) {
        return value == null ? EMPTY : new NullByte(value, true);
    }

    public static @NotNull NullByte empty() {
        return EMPTY;
    }
}
