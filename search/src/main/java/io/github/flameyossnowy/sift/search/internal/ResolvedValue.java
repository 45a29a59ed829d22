package io.github.flameyossnowy.sift.search.internal;

import org.jetbrains.annotations.Nullable;

/**
 * A field value after unwrapping, or the marker that there is nothing to filter on.
 */
public record ResolvedValue(@Nullable Object value, boolean present) {
    public static final ResolvedValue ABSENT = new ResolvedValue(null, false);

    public static ResolvedValue of(Object value) {
        return value == null ? ABSENT : new ResolvedValue(value, true);
    }
}
