package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.api.nullable.Nullable;
import io.github.flameyossnowy.sift.search.Condition;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.lang.reflect.Field;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Reads the value a condition refers to out of a filter instance.
 * <p>
 * A {@code null} anywhere along the field path, an empty {@link Optional} and an
 * invalid {@link Nullable} all resolve to {@link ResolvedValue#ABSENT}.
 */
public final class ValueExtractor {
    private final Logger logger;

    public ValueExtractor(@NotNull Logger logger) {
        this.logger = logger;
    }

    public @NotNull ResolvedValue extract(@NotNull Condition condition, Object instance) {
        Object current = instance;
        for (Field field : condition.fieldPath().fields()) {
            if (current == null) {
                return ResolvedValue.ABSENT;
            }
            try {
                current = field.get(current);
            } catch (IllegalAccessException | IllegalArgumentException e) {
                logger.warn("Could not read '{}' from {}", condition.fieldPath(), instance.getClass().getName(), e);
                return ResolvedValue.ABSENT;
            }
        }
        return unwrap(current);
    }

    static @NotNull ResolvedValue unwrap(Object value) {
        if (value == null) {
            return ResolvedValue.ABSENT;
        }
        if (value instanceof Nullable<?> nullable) {
            return nullable.isPresent() ? ResolvedValue.of(nullable.get()) : ResolvedValue.ABSENT;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? ResolvedValue.of(optional.get()) : ResolvedValue.ABSENT;
        }
        if (value instanceof OptionalInt optional) {
            return optional.isPresent() ? ResolvedValue.of(optional.getAsInt()) : ResolvedValue.ABSENT;
        }
        if (value instanceof OptionalLong optional) {
            return optional.isPresent() ? ResolvedValue.of(optional.getAsLong()) : ResolvedValue.ABSENT;
        }
        if (value instanceof OptionalDouble optional) {
            return optional.isPresent() ? ResolvedValue.of(optional.getAsDouble()) : ResolvedValue.ABSENT;
        }
        return ResolvedValue.of(value);
    }
}
