package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Nullable {@link String}; an empty string is a present value.
 */
public final class NullString extends NullableValue<String> {
    private static final NullString EMPTY = new NullString(null, false);

    private NullString(String value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is empty.
     */
    @Contract("_ -> new")
    public static @NotNull NullString of(@NotNull String value) {
        return new NullString(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullString ofNullable(String value) {
        return value == null ? EMPTY : new NullString(value, true);
    }

    public static @NotNull NullString empty() {
        return EMPTY;
    }
}
