package io.github.flameyossnowy.sift.api.query;

import java.util.Collection;
import java.util.function.Consumer;

/**
 * Query-engine capability that accumulates boolean conditions.
 * <p>
 * Every method adds one condition to the current scope. Plain methods join with AND, the
 * {@code or...} variants join with OR. {@link #group(Consumer)} opens a parenthesised scope.
 * Implementations decide how the result is rendered or executed.
 */
public interface ConditionBuilder extends Applier<ConditionBuilder> {

    // ==================== Comparison ====================

    ConditionBuilder equalTo(String column, Object value);
    ConditionBuilder orEqualTo(String column, Object value);
    ConditionBuilder notEqualTo(String column, Object value);
    ConditionBuilder orNotEqualTo(String column, Object value);
    ConditionBuilder greaterThan(String column, Object value);
    ConditionBuilder orGreaterThan(String column, Object value);
    ConditionBuilder greaterThanOrEqual(String column, Object value);
    ConditionBuilder orGreaterThanOrEqual(String column, Object value);
    ConditionBuilder lessThan(String column, Object value);
    ConditionBuilder orLessThan(String column, Object value);
    ConditionBuilder lessThanOrEqual(String column, Object value);
    ConditionBuilder orLessThanOrEqual(String column, Object value);

    // ==================== Range ====================

    ConditionBuilder between(String column, Object start, Object end);
    ConditionBuilder orBetween(String column, Object start, Object end);
    ConditionBuilder notBetween(String column, Object start, Object end);
    ConditionBuilder orNotBetween(String column, Object start, Object end);

    // ==================== Set membership ====================

    ConditionBuilder in(String column, Collection<?> values);
    ConditionBuilder orIn(String column, Collection<?> values);
    ConditionBuilder notIn(String column, Collection<?> values);
    ConditionBuilder orNotIn(String column, Collection<?> values);

    // ==================== Null checks ====================

    ConditionBuilder isNull(String column);
    ConditionBuilder orIsNull(String column);
    ConditionBuilder isNotNull(String column);
    ConditionBuilder orIsNotNull(String column);

    // ==================== Pattern matching ====================

    ConditionBuilder contains(String column, String value);
    ConditionBuilder orContains(String column, String value);
    ConditionBuilder notContains(String column, String value);
    ConditionBuilder orNotContains(String column, String value);
    ConditionBuilder containsIgnoreCase(String column, String value);
    ConditionBuilder orContainsIgnoreCase(String column, String value);
    ConditionBuilder notContainsIgnoreCase(String column, String value);
    ConditionBuilder orNotContainsIgnoreCase(String column, String value);

    ConditionBuilder startsWith(String column, String value);
    ConditionBuilder orStartsWith(String column, String value);
    ConditionBuilder notStartsWith(String column, String value);
    ConditionBuilder orNotStartsWith(String column, String value);
    ConditionBuilder startsWithIgnoreCase(String column, String value);
    ConditionBuilder orStartsWithIgnoreCase(String column, String value);
    ConditionBuilder notStartsWithIgnoreCase(String column, String value);
    ConditionBuilder orNotStartsWithIgnoreCase(String column, String value);

    ConditionBuilder endsWith(String column, String value);
    ConditionBuilder orEndsWith(String column, String value);
    ConditionBuilder notEndsWith(String column, String value);
    ConditionBuilder orNotEndsWith(String column, String value);
    ConditionBuilder endsWithIgnoreCase(String column, String value);
    ConditionBuilder orEndsWithIgnoreCase(String column, String value);
    ConditionBuilder notEndsWithIgnoreCase(String column, String value);
    ConditionBuilder orNotEndsWithIgnoreCase(String column, String value);

    // ==================== Grouping ====================

    /**
     * Adds a parenthesised group joined to the current scope with AND.
     */
    ConditionBuilder group(Consumer<ConditionBuilder> builder);

    /**
     * Adds a parenthesised group joined to the current scope with OR.
     */
    ConditionBuilder orGroup(Consumer<ConditionBuilder> builder);
}
