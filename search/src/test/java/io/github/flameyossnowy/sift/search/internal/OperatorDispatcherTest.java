package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.api.options.FilterTreeBuilder;
import io.github.flameyossnowy.sift.api.query.ConditionBuilder;
import io.github.flameyossnowy.sift.api.range.Range;
import io.github.flameyossnowy.sift.search.Operator;
import io.github.flameyossnowy.sift.search.SearchOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.flameyossnowy.sift.search.internal.TestConditions.condition;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OperatorDispatcherTest {
    private final OperatorDispatcher dispatcher = new OperatorDispatcher(SearchOptions.defaults());
    private ConditionBuilder builder;

    @BeforeEach
    void setUp() {
        builder = mock(ConditionBuilder.class);
    }

    // ==================== Comparison ====================

    @Test
    void comparison_operators_map_to_builder_methods() {
        dispatcher.dispatch(builder, condition(Operator.EQ, Map.of(), "a"), 1, null);
        dispatcher.dispatch(builder, condition(Operator.NEQ, Map.of(), "b"), 2, null);
        dispatcher.dispatch(builder, condition(Operator.GT, Map.of(), "c"), 3, null);
        dispatcher.dispatch(builder, condition(Operator.GTE, Map.of(), "d"), 4, null);
        dispatcher.dispatch(builder, condition(Operator.LT, Map.of(), "e"), 5, null);
        dispatcher.dispatch(builder, condition(Operator.LTE, Map.of(), "f"), 6, null);

        verify(builder).equalTo("a", 1);
        verify(builder).notEqualTo("b", 2);
        verify(builder).greaterThan("c", 3);
        verify(builder).greaterThanOrEqual("d", 4);
        verify(builder).lessThan("e", 5);
        verify(builder).lessThanOrEqual("f", 6);
        verifyNoMoreInteractions(builder);
    }

    @Test
    void comparison_forwards_value_unchanged() {
        LocalDate day = LocalDate.of(2024, 5, 1);
        dispatcher.dispatch(builder, condition(Operator.GTE, Map.of(), "created_at"), day, null);

        verify(builder).greaterThanOrEqual("created_at", day);
    }

    // ==================== Alias ====================

    @Test
    void condition_alias_wins_over_default_alias() {
        dispatcher.dispatch(builder, condition(Operator.EQ, "u", Map.of(), "name"), "x", "t");
        dispatcher.dispatch(builder, condition(Operator.EQ, Map.of(), "code"), "y", "t");
        dispatcher.dispatch(builder, condition(Operator.EQ, Map.of(), "plain"), "z", null);

        verify(builder).equalTo("u.name", "x");
        verify(builder).equalTo("t.code", "y");
        verify(builder).equalTo("plain", "z");
    }

    // ==================== Range ====================

    @Test
    void between_and_not_between() {
        dispatcher.dispatch(builder, condition(Operator.BETWEEN, Map.of(), "price"), Range.of(10, 20), null);
        dispatcher.dispatch(builder, condition(Operator.NOT_BETWEEN, Map.of("type", "int"), "age"), "18,65", null);

        verify(builder).between("price", 10, 20);
        verify(builder).notBetween("age", 18, 65);
    }

    @Test
    void unparsable_range_makes_no_call() {
        dispatcher.dispatch(builder, condition(Operator.BETWEEN, Map.of("type", "int"), "price"), "1,2,3", null);

        verifyNoInteractions(builder);
    }

    // ==================== Set ====================

    @Test
    void set_string_uses_default_comma_delimiter() {
        dispatcher.dispatch(builder, condition(Operator.IN, Map.of(), "id"), "1,2,3", null);

        verify(builder).in("id", List.of("1", "2", "3"));
        verifyNoMoreInteractions(builder);
    }

    @Test
    void set_string_split_on_every_delimiter() {
        dispatcher.dispatch(builder, condition(Operator.IN, Map.of("delimiter", "|"), "status"), "active|pending|", null);

        verify(builder).in("status", List.of("active", "pending", ""));
    }

    @Test
    void set_with_int_type_is_coerced() {
        dispatcher.dispatch(builder, condition(Operator.NOT_IN, Map.of("delimiter", ";", "type", "int"), "id"), "1; 2;3", null);

        verify(builder).notIn("id", List.of(1, 2, 3));
    }

    @Test
    void set_with_unparsable_int_is_skipped() {
        dispatcher.dispatch(builder, condition(Operator.IN, Map.of("type", "int"), "id"), "1,two,3", null);

        verifyNoInteractions(builder);
    }

    @Test
    void empty_set_makes_no_call() {
        dispatcher.dispatch(builder, condition(Operator.IN, Map.of(), "id"), "", null);
        dispatcher.dispatch(builder, condition(Operator.IN, Map.of(), "id"), List.of(), null);
        dispatcher.dispatch(builder, condition(Operator.NOT_IN, Map.of(), "id"), new String[0], null);

        verifyNoInteractions(builder);
    }

    @Test
    void collections_and_arrays_are_used_as_is() {
        dispatcher.dispatch(builder, condition(Operator.IN, Map.of(), "id"), Set.of(7), null);
        dispatcher.dispatch(builder, condition(Operator.IN, Map.of(), "code"), new long[] {4L, 5L}, null);

        verify(builder).in("id", List.of(7));
        verify(builder).in("code", List.of(4L, 5L));
    }

    // ==================== Null checks ====================

    @Test
    void null_check_fires_only_on_true() {
        dispatcher.dispatch(builder, condition(Operator.IS_NULL, Map.of(), "deleted_at"), true, null);
        dispatcher.dispatch(builder, condition(Operator.IS_NOT_NULL, Map.of(), "updated_at"), Boolean.TRUE, "t");

        verify(builder).isNull("deleted_at");
        verify(builder).isNotNull("t.updated_at");
        verifyNoMoreInteractions(builder);
    }

    @Test
    void null_check_false_or_non_boolean_makes_no_call() {
        dispatcher.dispatch(builder, condition(Operator.IS_NULL, Map.of(), "deleted_at"), false, null);
        dispatcher.dispatch(builder, condition(Operator.IS_NOT_NULL, Map.of(), "deleted_at"), "true", null);

        verifyNoInteractions(builder);
    }

    // ==================== Pattern ====================

    @Test
    void single_column_pattern_calls_directly() {
        dispatcher.dispatch(builder, condition(Operator.CONTAINS, Map.of(), "name"), "ali", null);
        dispatcher.dispatch(builder, condition(Operator.NOT_STARTS_WITH_IGNORE_CASE, Map.of(), "title"), "the", null);
        dispatcher.dispatch(builder, condition(Operator.ENDS_WITH, Map.of(), "email"), "@x.io", "u");

        verify(builder).contains("name", "ali");
        verify(builder).notStartsWithIgnoreCase("title", "the");
        verify(builder).endsWith("u.email", "@x.io");
        verifyNoMoreInteractions(builder);
    }

    @Test
    void empty_or_non_string_pattern_makes_no_call() {
        dispatcher.dispatch(builder, condition(Operator.CONTAINS, Map.of(), "name"), "", null);
        dispatcher.dispatch(builder, condition(Operator.CONTAINS, Map.of(), "name"), 42, null);

        verifyNoInteractions(builder);
    }

    @Test
    void multi_column_pattern_is_one_or_group() {
        FilterTreeBuilder tree = new FilterTreeBuilder();
        dispatcher.dispatch(tree, condition(Operator.CONTAINS_IGNORE_CASE, Map.of(), "title", "description"), "java", "p");

        assertEquals("(p.title CONTAINS IGNORE CASE java OR p.description CONTAINS IGNORE CASE java)", tree.toString());
        assertEquals(1, tree.filters().size());
    }
}
