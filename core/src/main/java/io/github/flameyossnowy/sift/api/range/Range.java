package io.github.flameyossnowy.sift.api.range;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Inclusive interval with a start and an end.
 * <p>
 * Filter fields of this type are read directly by range operators; either endpoint may be
 * {@code null} when bound from a partial request.
 */
public record Range<T>(T start, T end) {

    @Contract(value = "_, _ -> new", pure = true)
    public static <T> @NotNull Range<T> of(T start, T end) {
        return new Range<>(start, end);
    }

    /**
     * Whether {@code value} lies between both endpoints, inclusive.
     * A {@code null} endpoint leaves that side open.
     */
    public static <C extends Comparable<? super C>> boolean contains(@NotNull Range<C> range, @NotNull C value) {
        if (range.start() != null && value.compareTo(range.start()) < 0) {
            return false;
        }
        return range.end() == null || value.compareTo(range.end()) <= 0;
    }
}
