package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;

/**
 * Nullable calendar date without a time.
 */
public final class NullDate extends NullableValue<LocalDate> {
    private static final NullDate EMPTY = new NullDate(null, false);

    private NullDate(LocalDate value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper.
     */
    @Contract("_ -> new")
    public static @NotNull NullDate of(@NotNull LocalDate value) {
        return new NullDate(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullDate ofNullable(LocalDate value) {
        return value == null ? EMPTY : new NullDate(value, true);
    }

    public static @NotNull NullDate empty() {
        return EMPTY;
    }
}
