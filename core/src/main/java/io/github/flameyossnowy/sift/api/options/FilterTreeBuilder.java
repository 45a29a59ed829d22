package io.github.flameyossnowy.sift.api.options;

import io.github.flameyossnowy.sift.api.query.ApplyFunction;
import io.github.flameyossnowy.sift.api.query.ConditionBuilder;
import io.github.flameyossnowy.sift.api.range.Range;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Unmodifiable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * {@link ConditionBuilder} that records every call as a backend-agnostic tree of
 * {@link FilterOption}s.
 * <p>
 * Adapters translate the tree into their own query language; nothing here is SQL. Groups
 * that end up empty are dropped.
 *
 * <pre>{@code
 * FilterTreeBuilder builder = new FilterTreeBuilder();
 * builder.greaterThanOrEqual("age", 18)
 *        .group(g -> g.orContains("title", "java").orContains("body", "java"));
 *
 * builder.filters(); // [age >= 18, (title CONTAINS java OR body CONTAINS java)]
 * }</pre>
 */
public class FilterTreeBuilder implements ConditionBuilder {
    public static final String EQ = "=";
    public static final String NE = "!=";
    public static final String GT = ">";
    public static final String GTE = ">=";
    public static final String LT = "<";
    public static final String LTE = "<=";
    public static final String BETWEEN = "BETWEEN";
    public static final String NOT_BETWEEN = "NOT BETWEEN";
    public static final String IN = "IN";
    public static final String NOT_IN = "NOT IN";
    public static final String IS_NULL = "IS NULL";
    public static final String IS_NOT_NULL = "IS NOT NULL";
    public static final String CONTAINS = "CONTAINS";
    public static final String NOT_CONTAINS = "NOT CONTAINS";
    public static final String STARTS_WITH = "STARTS WITH";
    public static final String NOT_STARTS_WITH = "NOT STARTS WITH";
    public static final String ENDS_WITH = "ENDS WITH";
    public static final String NOT_ENDS_WITH = "NOT ENDS WITH";
    public static final String IGNORE_CASE = " IGNORE CASE";

    private final List<FilterOption> filters = new ArrayList<>();

    /**
     * The recorded filters of the top-level scope, in call order.
     */
    public @Unmodifiable List<FilterOption> filters() {
        return List.copyOf(filters);
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    private FilterTreeBuilder add(Conjunction conjunction, String column, String operator, Object value) {
        filters.add(new SelectOption(conjunction, column, operator, value));
        return this;
    }

    private static List<Object> snapshot(Collection<?> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    private FilterTreeBuilder addGroup(Conjunction conjunction, @NotNull Consumer<ConditionBuilder> builder) {
        FilterTreeBuilder scope = new FilterTreeBuilder();
        builder.accept(scope);
        if (!scope.filters.isEmpty()) {
            filters.add(new GroupOption(conjunction, scope.filters));
        }
        return this;
    }

    // ==================== Comparison ====================

    @Override public ConditionBuilder equalTo(String column, Object value) { return add(Conjunction.AND, column, EQ, value); }
    @Override public ConditionBuilder orEqualTo(String column, Object value) { return add(Conjunction.OR, column, EQ, value); }
    @Override public ConditionBuilder notEqualTo(String column, Object value) { return add(Conjunction.AND, column, NE, value); }
    @Override public ConditionBuilder orNotEqualTo(String column, Object value) { return add(Conjunction.OR, column, NE, value); }
    @Override public ConditionBuilder greaterThan(String column, Object value) { return add(Conjunction.AND, column, GT, value); }
    @Override public ConditionBuilder orGreaterThan(String column, Object value) { return add(Conjunction.OR, column, GT, value); }
    @Override public ConditionBuilder greaterThanOrEqual(String column, Object value) { return add(Conjunction.AND, column, GTE, value); }
    @Override public ConditionBuilder orGreaterThanOrEqual(String column, Object value) { return add(Conjunction.OR, column, GTE, value); }
    @Override public ConditionBuilder lessThan(String column, Object value) { return add(Conjunction.AND, column, LT, value); }
    @Override public ConditionBuilder orLessThan(String column, Object value) { return add(Conjunction.OR, column, LT, value); }
    @Override public ConditionBuilder lessThanOrEqual(String column, Object value) { return add(Conjunction.AND, column, LTE, value); }
    @Override public ConditionBuilder orLessThanOrEqual(String column, Object value) { return add(Conjunction.OR, column, LTE, value); }

    // ==================== Range ====================

    @Override public ConditionBuilder between(String column, Object start, Object end) { return add(Conjunction.AND, column, BETWEEN, Range.of(start, end)); }
    @Override public ConditionBuilder orBetween(String column, Object start, Object end) { return add(Conjunction.OR, column, BETWEEN, Range.of(start, end)); }
    @Override public ConditionBuilder notBetween(String column, Object start, Object end) { return add(Conjunction.AND, column, NOT_BETWEEN, Range.of(start, end)); }
    @Override public ConditionBuilder orNotBetween(String column, Object start, Object end) { return add(Conjunction.OR, column, NOT_BETWEEN, Range.of(start, end)); }

    // ==================== Set membership ====================

    @Override public ConditionBuilder in(String column, Collection<?> values) { return add(Conjunction.AND, column, IN, snapshot(values)); }
    @Override public ConditionBuilder orIn(String column, Collection<?> values) { return add(Conjunction.OR, column, IN, snapshot(values)); }
    @Override public ConditionBuilder notIn(String column, Collection<?> values) { return add(Conjunction.AND, column, NOT_IN, snapshot(values)); }
    @Override public ConditionBuilder orNotIn(String column, Collection<?> values) { return add(Conjunction.OR, column, NOT_IN, snapshot(values)); }

    // ==================== Null checks ====================

    @Override public ConditionBuilder isNull(String column) { return add(Conjunction.AND, column, IS_NULL, null); }
    @Override public ConditionBuilder orIsNull(String column) { return add(Conjunction.OR, column, IS_NULL, null); }
    @Override public ConditionBuilder isNotNull(String column) { return add(Conjunction.AND, column, IS_NOT_NULL, null); }
    @Override public ConditionBuilder orIsNotNull(String column) { return add(Conjunction.OR, column, IS_NOT_NULL, null); }

    // ==================== Pattern matching ====================

    @Override public ConditionBuilder contains(String column, String value) { return add(Conjunction.AND, column, CONTAINS, value); }
    @Override public ConditionBuilder orContains(String column, String value) { return add(Conjunction.OR, column, CONTAINS, value); }
    @Override public ConditionBuilder notContains(String column, String value) { return add(Conjunction.AND, column, NOT_CONTAINS, value); }
    @Override public ConditionBuilder orNotContains(String column, String value) { return add(Conjunction.OR, column, NOT_CONTAINS, value); }
    @Override public ConditionBuilder containsIgnoreCase(String column, String value) { return add(Conjunction.AND, column, CONTAINS + IGNORE_CASE, value); }
    @Override public ConditionBuilder orContainsIgnoreCase(String column, String value) { return add(Conjunction.OR, column, CONTAINS + IGNORE_CASE, value); }
    @Override public ConditionBuilder notContainsIgnoreCase(String column, String value) { return add(Conjunction.AND, column, NOT_CONTAINS + IGNORE_CASE, value); }
    @Override public ConditionBuilder orNotContainsIgnoreCase(String column, String value) { return add(Conjunction.OR, column, NOT_CONTAINS + IGNORE_CASE, value); }

    @Override public ConditionBuilder startsWith(String column, String value) { return add(Conjunction.AND, column, STARTS_WITH, value); }
    @Override public ConditionBuilder orStartsWith(String column, String value) { return add(Conjunction.OR, column, STARTS_WITH, value); }
    @Override public ConditionBuilder notStartsWith(String column, String value) { return add(Conjunction.AND, column, NOT_STARTS_WITH, value); }
    @Override public ConditionBuilder orNotStartsWith(String column, String value) { return add(Conjunction.OR, column, NOT_STARTS_WITH, value); }
    @Override public ConditionBuilder startsWithIgnoreCase(String column, String value) { return add(Conjunction.AND, column, STARTS_WITH + IGNORE_CASE, value); }
    @Override public ConditionBuilder orStartsWithIgnoreCase(String column, String value) { return add(Conjunction.OR, column, STARTS_WITH + IGNORE_CASE, value); }
    @Override public ConditionBuilder notStartsWithIgnoreCase(String column, String value) { return add(Conjunction.AND, column, NOT_STARTS_WITH + IGNORE_CASE, value); }
    @Override public ConditionBuilder orNotStartsWithIgnoreCase(String column, String value) { return add(Conjunction.OR, column, NOT_STARTS_WITH + IGNORE_CASE, value); }

    @Override public ConditionBuilder endsWith(String column, String value) { return add(Conjunction.AND, column, ENDS_WITH, value); }
    @Override public ConditionBuilder orEndsWith(String column, String value) { return add(Conjunction.OR, column, ENDS_WITH, value); }
    @Override public ConditionBuilder notEndsWith(String column, String value) { return add(Conjunction.AND, column, NOT_ENDS_WITH, value); }
    @Override public ConditionBuilder orNotEndsWith(String column, String value) { return add(Conjunction.OR, column, NOT_ENDS_WITH, value); }
    @Override public ConditionBuilder endsWithIgnoreCase(String column, String value) { return add(Conjunction.AND, column, ENDS_WITH + IGNORE_CASE, value); }
    @Override public ConditionBuilder orEndsWithIgnoreCase(String column, String value) { return add(Conjunction.OR, column, ENDS_WITH + IGNORE_CASE, value); }
    @Override public ConditionBuilder notEndsWithIgnoreCase(String column, String value) { return add(Conjunction.AND, column, NOT_ENDS_WITH + IGNORE_CASE, value); }
    @Override public ConditionBuilder orNotEndsWithIgnoreCase(String column, String value) { return add(Conjunction.OR, column, NOT_ENDS_WITH + IGNORE_CASE, value); }

    // ==================== Grouping ====================

    @Override
    public ConditionBuilder group(Consumer<ConditionBuilder> builder) {
        return addGroup(Conjunction.AND, builder);
    }

    @Override
    public ConditionBuilder orGroup(Consumer<ConditionBuilder> builder) {
        return addGroup(Conjunction.OR, builder);
    }

    // ==================== Applier ====================

    @SafeVarargs
    @Override
    public final ConditionBuilder apply(ApplyFunction<ConditionBuilder>... functions) {
        ConditionBuilder current = this;
        for (ApplyFunction<ConditionBuilder> function : functions) {
            current = function.apply(current);
        }
        return current;
    }

    @SafeVarargs
    @Override
    public final ConditionBuilder applyIf(boolean condition, ApplyFunction<ConditionBuilder>... functions) {
        return condition ? apply(functions) : this;
    }

    @Override
    public String toString() {
        return describe(filters);
    }

    private static String describe(List<FilterOption> filters) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < filters.size(); i++) {
            FilterOption filter = filters.get(i);
            if (i > 0) {
                out.append(' ').append(filter.conjunction()).append(' ');
            }

            if (filter instanceof SelectOption s) {
                out.append(s.option()).append(' ').append(s.operator());
                if (s.value() != null) {
                    out.append(' ').append(s.value());
                }
                continue;
            }

            if (filter instanceof GroupOption g) {
                out.append('(').append(describe(g.filters())).append(')');
            }
        }
        return out.toString();
    }
}
