package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.time.LocalTime;

/**
 * Nullable time of day.
 */
public final class NullTime extends NullableValue<LocalTime> {
    private static final NullTime EMPTY = new NullTime(null, false);

    private NullTime(LocalTime value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper.
     */
    @Contract("_ -> new")
    public static @NotNull NullTime of(@NotNull LocalTime value) {
        return new NullTime(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullTime ofNullable(LocalTime value) {
        return value == null ? EMPTY : new NullTime(value, true);
    }

    public static @NotNull NullTime empty() {
        return EMPTY;
    }
}
