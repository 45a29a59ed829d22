package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.api.query.ConditionBuilder;
import io.github.flameyossnowy.sift.api.range.Range;
import io.github.flameyossnowy.sift.search.Condition;
import io.github.flameyossnowy.sift.search.Operator;
import io.github.flameyossnowy.sift.search.SearchOptions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.lang.reflect.Array;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Translates one resolved condition into calls on a {@link ConditionBuilder}.
 * <p>
 * Values that do not fit the operator's family are skipped, never thrown.
 */
public final class OperatorDispatcher {
    private final SearchOptions options;
    private final RangeParser ranges;
    private final TypedValueParser values;
    private final Logger logger;

    public OperatorDispatcher(@NotNull SearchOptions options) {
        this.options = options;
        this.ranges = new RangeParser(options);
        this.values = new TypedValueParser(options);
        this.logger = options.logger();
    }

    public void dispatch(@NotNull ConditionBuilder builder, @NotNull Condition condition,
                         @NotNull Object value, @Nullable String defaultAlias) {
        String alias = condition.alias() != null ? condition.alias() : defaultAlias;
        Operator operator = condition.operator();

        switch (operator.family()) {
            case COMPARISON -> compare(builder, operator, ColumnNames.qualify(alias, condition.column()), value);
            case RANGE -> ranges.parse(condition, value).ifPresent(range ->
                between(builder, operator, ColumnNames.qualify(alias, condition.column()), range));
            case SET -> parseSet(condition, value).ifPresent(list ->
                in(builder, operator, ColumnNames.qualify(alias, condition.column()), list));
            case NULL_CHECK -> nullCheck(builder, operator, ColumnNames.qualify(alias, condition.column()), value);
            case PATTERN -> pattern(builder, condition, alias, value);
        }
    }

    // ==================== Families ====================

    private static void compare(ConditionBuilder builder, Operator operator, String column, Object value) {
        switch (operator) {
            case EQ -> builder.equalTo(column, value);
            case NEQ -> builder.notEqualTo(column, value);
            case GT -> builder.greaterThan(column, value);
            case GTE -> builder.greaterThanOrEqual(column, value);
            case LT -> builder.lessThan(column, value);
            case LTE -> builder.lessThanOrEqual(column, value);
            default -> throw new IllegalStateException("Not a comparison operator: " + operator);
        }
    }

    private static void between(ConditionBuilder builder, Operator operator, String column, Range<Object> range) {
        if (operator == Operator.NOT_BETWEEN) {
            builder.notBetween(column, range.start(), range.end());
        } else {
            builder.between(column, range.start(), range.end());
        }
    }

    private static void in(ConditionBuilder builder, Operator operator, String column, List<Object> list) {
        if (list.isEmpty()) {
            return;
        }
        if (operator == Operator.NOT_IN) {
            builder.notIn(column, list);
        } else {
            builder.in(column, list);
        }
    }

    private static void nullCheck(ConditionBuilder builder, Operator operator, String column, Object value) {
        if (!Boolean.TRUE.equals(value)) {
            return;
        }
        if (operator == Operator.IS_NOT_NULL) {
            builder.isNotNull(column);
        } else {
            builder.isNull(column);
        }
    }

    private void pattern(ConditionBuilder builder, Condition condition, String alias, Object value) {
        if (!(value instanceof CharSequence sequence)) {
            logger.warn("Skipping '{}': '{}' needs a string value, got {}",
                condition.fieldPath(), condition.operator(), value.getClass().getName());
            return;
        }
        if (sequence.length() == 0) {
            return;
        }

        String text = sequence.toString();
        Operator operator = condition.operator();
        List<String> columns = condition.columns();
        if (columns.size() == 1) {
            match(builder, operator, ColumnNames.qualify(alias, columns.get(0)), text, false);
            return;
        }

        builder.group(group -> {
            for (String column : columns) {
                match(group, operator, ColumnNames.qualify(alias, column), text, true);
            }
        });
    }

    private static void match(ConditionBuilder builder, Operator operator, String column, String text, boolean or) {
        switch (operator) {
            case CONTAINS -> { if (or) builder.orContains(column, text); else builder.contains(column, text); }
            case NOT_CONTAINS -> { if (or) builder.orNotContains(column, text); else builder.notContains(column, text); }
            case STARTS_WITH -> { if (or) builder.orStartsWith(column, text); else builder.startsWith(column, text); }
            case NOT_STARTS_WITH -> { if (or) builder.orNotStartsWith(column, text); else builder.notStartsWith(column, text); }
            case ENDS_WITH -> { if (or) builder.orEndsWith(column, text); else builder.endsWith(column, text); }
            case NOT_ENDS_WITH -> { if (or) builder.orNotEndsWith(column, text); else builder.notEndsWith(column, text); }
            case CONTAINS_IGNORE_CASE -> { if (or) builder.orContainsIgnoreCase(column, text); else builder.containsIgnoreCase(column, text); }
            case NOT_CONTAINS_IGNORE_CASE -> { if (or) builder.orNotContainsIgnoreCase(column, text); else builder.notContainsIgnoreCase(column, text); }
            case STARTS_WITH_IGNORE_CASE -> { if (or) builder.orStartsWithIgnoreCase(column, text); else builder.startsWithIgnoreCase(column, text); }
            case NOT_STARTS_WITH_IGNORE_CASE -> { if (or) builder.orNotStartsWithIgnoreCase(column, text); else builder.notStartsWithIgnoreCase(column, text); }
            case ENDS_WITH_IGNORE_CASE -> { if (or) builder.orEndsWithIgnoreCase(column, text); else builder.endsWithIgnoreCase(column, text); }
            case NOT_ENDS_WITH_IGNORE_CASE -> { if (or) builder.orNotEndsWithIgnoreCase(column, text); else builder.notEndsWithIgnoreCase(column, text); }
            default -> throw new IllegalStateException("Not a pattern operator: " + operator);
        }
    }

    // ==================== Set values ====================

    Optional<List<Object>> parseSet(Condition condition, Object value) {
        if (value instanceof Collection<?> collection) {
            return Optional.of(new ArrayList<>(collection));
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return Optional.of(list);
        }
        if (!(value instanceof CharSequence sequence)) {
            logger.warn("Skipping '{}': {} cannot be read as a list of values",
                condition.fieldPath(), value.getClass().getName());
            return Optional.empty();
        }

        String text = sequence.toString();
        if (text.isEmpty()) {
            return Optional.of(List.of());
        }

        String delimiter = condition.param(Condition.PARAM_DELIMITER, options.defaultDelimiter());
        String[] parts = text.split(Pattern.quote(delimiter), -1);
        String type = condition.param(Condition.PARAM_TYPE);
        List<Object> list = new ArrayList<>(parts.length);
        if (!TypedValueParser.isKnownType(type)) {
            list.addAll(Arrays.asList(parts));
            return Optional.of(list);
        }

        for (String part : parts) {
            try {
                list.add(values.parse(type, part.trim()));
            } catch (IllegalArgumentException | DateTimeException e) {
                logger.warn("Skipping '{}': could not parse '{}' as {}: {}", condition.fieldPath(), part, type, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(list);
    }
}
