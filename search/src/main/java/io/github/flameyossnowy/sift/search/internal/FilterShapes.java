package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.api.nullable.Nullable;
import io.github.flameyossnowy.sift.api.range.Range;
import org.jetbrains.annotations.NotNull;

public final class FilterShapes {
    private FilterShapes() {
    }

    /**
     * Whether the type can be walked as a filter: a concrete class or record of the
     * application's own, as opposed to a JDK type, a value wrapper, or a primitive.
     */
    public static boolean isFilterShape(@NotNull Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isInterface()
            || type.isEnum() || type.isAnnotation()) {
            return false;
        }
        if (Nullable.class.isAssignableFrom(type) || Range.class == type) {
            return false;
        }

        String packageName = type.getPackageName();
        return !packageName.startsWith("java.") && !packageName.startsWith("javax.");
    }
}
