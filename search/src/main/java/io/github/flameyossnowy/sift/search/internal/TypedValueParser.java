package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.search.SearchOptions;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;

/**
 * Converts the textual parts of range and set strings according to a {@code type} param.
 */
public final class TypedValueParser {
    public static final String INT = "int";
    public static final String LONG = "long";
    public static final String DECIMAL = "decimal";
    public static final String DATE = "date";
    public static final String TIME = "time";
    public static final String DATETIME = "datetime";

    private final SearchOptions options;

    public TypedValueParser(@NotNull SearchOptions options) {
        this.options = options;
    }

    public static boolean isKnownType(String type) {
        if (type == null) return false;
        return switch (type.toLowerCase(Locale.ROOT)) {
            case INT, LONG, DECIMAL, DATE, TIME, DATETIME -> true;
            default -> false;
        };
    }

    /**
     * Parses {@code text} as the given type.
     *
     * @throws IllegalArgumentException        if the type is unknown or a number is malformed
     * @throws java.time.DateTimeException     if a temporal value does not match the configured layout
     */
    public @NotNull Object parse(@NotNull String type, @NotNull String text) {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case INT -> Integer.parseInt(text);
            case LONG -> Long.parseLong(text);
            case DECIMAL -> new BigDecimal(text);
            case DATE -> LocalDate.parse(text, options.dateFormat());
            case TIME -> LocalTime.parse(text, options.timeFormat());
            case DATETIME -> LocalDateTime.parse(text, options.dateTimeFormat());
            default -> throw new IllegalArgumentException("Unknown value type '" + type + "'");
        };
    }
}
