package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.api.range.Range;
import io.github.flameyossnowy.sift.search.Condition;
import io.github.flameyossnowy.sift.search.SearchOptions;
import io.github.flameyossnowy.sift.search.exceptions.SearchDefinitionException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.time.DateTimeException;
import java.util.Collection;
import java.util.Iterator;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads a pair of endpoints out of a range-operator field.
 * <p>
 * Accepted shapes:
 * <ul>
 *     <li>a {@link Range}, endpoints taken as-is;</li>
 *     <li>a string {@code "start<delimiter>end"}, each part trimmed and converted with the
 *     {@code type} param ({@code int}, {@code long}, {@code decimal}, {@code date},
 *     {@code time} or {@code datetime});</li>
 *     <li>a collection or array of exactly two elements.</li>
 * </ul>
 * Anything else yields no range, with a warning.
 */
public final class RangeParser {
    private static final Method START_ACCESSOR;
    private static final Method END_ACCESSOR;

    static {
        START_ACCESSOR = resolveAccessor(Range.class, "start");
        END_ACCESSOR = resolveAccessor(Range.class, "end");
    }

    private final SearchOptions options;
    private final TypedValueParser values;
    private final Logger logger;

    public RangeParser(@NotNull SearchOptions options) {
        this.options = options;
        this.values = new TypedValueParser(options);
        this.logger = options.logger();
    }

    static @NotNull Method resolveAccessor(@NotNull Class<?> rangeType, @NotNull String component) {
        RecordComponent[] components = rangeType.getRecordComponents();
        if (components != null) {
            for (RecordComponent recordComponent : components) {
                if (recordComponent.getName().equals(component)) {
                    return recordComponent.getAccessor();
                }
            }
        }
        throw new SearchDefinitionException(
            "Range type " + rangeType.getName() + " must declare a '" + component + "' component");
    }

    public @NotNull Optional<Range<Object>> parse(@NotNull Condition condition, @NotNull Object value) {
        if (value instanceof Range<?> range) {
            return fromRange(condition, range);
        }
        if (value instanceof CharSequence text) {
            return fromString(condition, text.toString());
        }
        if (value instanceof Collection<?> collection) {
            if (collection.size() != 2) {
                logger.warn("Skipping '{}': a range needs exactly 2 elements, got {}", condition.fieldPath(), collection.size());
                return Optional.empty();
            }
            Iterator<?> iterator = collection.iterator();
            Object start = iterator.next();
            Object end = iterator.next();
            return Optional.of(Range.of(start, end));
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            if (length != 2) {
                logger.warn("Skipping '{}': a range needs exactly 2 elements, got {}", condition.fieldPath(), length);
                return Optional.empty();
            }
            Object start = Array.get(value, 0);
            Object end = Array.get(value, 1);
            return Optional.of(Range.of(start, end));
        }

        logger.warn("Skipping '{}': {} cannot be read as a range", condition.fieldPath(), value.getClass().getName());
        return Optional.empty();
    }

    private Optional<Range<Object>> fromRange(Condition condition, Range<?> range) {
        try {
            Object start = START_ACCESSOR.invoke(range);
            Object end = END_ACCESSOR.invoke(range);
            return Optional.of(Range.of(start, end));
        } catch (IllegalAccessException | InvocationTargetException e) {
            logger.warn("Skipping '{}': could not read range endpoints", condition.fieldPath(), e);
            return Optional.empty();
        }
    }

    private Optional<Range<Object>> fromString(Condition condition, String text) {
        String type = condition.param(Condition.PARAM_TYPE);
        if (!TypedValueParser.isKnownType(type)) {
            logger.warn("Skipping '{}': string ranges need a type param (int, long, decimal, date, time, datetime), got '{}'",
                condition.fieldPath(), type);
            return Optional.empty();
        }

        String delimiter = condition.param(Condition.PARAM_DELIMITER, options.defaultDelimiter());
        String[] parts = text.split(Pattern.quote(delimiter), 2);
        if (parts.length != 2) {
            logger.warn("Skipping '{}': expected 'start{}end' but got '{}'", condition.fieldPath(), delimiter, text);
            return Optional.empty();
        }

        try {
            Object start = values.parse(type, parts[0].trim());
            Object end = values.parse(type, parts[1].trim());
            return Optional.of(Range.of(start, end));
        } catch (IllegalArgumentException | DateTimeException e) {
            logger.warn("Skipping '{}': could not parse '{}' as a {} range: {}", condition.fieldPath(), text, type, e.getMessage());
            return Optional.empty();
        }
    }
}
