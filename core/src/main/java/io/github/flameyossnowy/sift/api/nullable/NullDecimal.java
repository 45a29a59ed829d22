package io.github.flameyossnowy.sift.api.nullable;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;

/**
 * Nullable {@link BigDecimal}.
 */
public final class NullDecimal extends NullableValue<BigDecimal> {
    private static final NullDecimal EMPTY = new NullDecimal(null, false);

    private NullDecimal(BigDecimal value, boolean valid) {
        super(value, valid);
    }

    /**
     * A present wrapper, even when {@code value} is zero.
     */
    @Contract("_ -> new")
    public static @NotNull NullDecimal of(@NotNull BigDecimal value) {
        return new NullDecimal(value, true);
    }

    /**
     * A wrapper that is absent when {@code value} is {@code null}.
     */
    public static @NotNull NullDecimal ofNullable(BigDecimal value) {
        return value == null ? EMPTY : new NullDecimal(value, true);
    }

    public static @NotNull NullDecimal empty() {
        return EMPTY;
    }
}
