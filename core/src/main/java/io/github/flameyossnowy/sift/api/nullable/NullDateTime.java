package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDateTime;

/**
 * Nullable local date and time.
 */
public final class NullDateTime extends NullableValue<LocalDateTime> {
    private static final NullDateTime EMPTY = new NullDateTime(null, false);

    private NullDateTime(LocalDateTime value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper.
     */
    @Contract("_ -> new")
    public static @NotNull NullDateTime of(@NotNull LocalDateTime value) {
        return new NullDateTime(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullDateTime ofNullable(LocalDateTime value) {
        return value == null ? EMPTY : new NullDateTime(value, true);
    }

    public static @NotNull NullDateTime empty() {
        return EMPTY;
    }
}
