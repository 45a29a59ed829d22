package io.github.flameyossnowy.sift.api.options;

import io.github.flameyossnowy.sift.api.query.ConditionBuilder;
import io.github.flameyossnowy.sift.api.range.Range;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterTreeBuilderTest {

    @Test
    void records_calls_in_order_with_conjunctions() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.equalTo("name", "alice")
            .orGreaterThan("age", 30)
            .isNull("deleted_at");

        List<FilterOption> filters = builder.filters();
        assertEquals(3, filters.size());
        assertEquals(new SelectOption(Conjunction.AND, "name", FilterTreeBuilder.EQ, "alice"), filters.get(0));
        assertEquals(new SelectOption(Conjunction.OR, "age", FilterTreeBuilder.GT, 30), filters.get(1));
        assertEquals(new SelectOption(Conjunction.AND, "deleted_at", FilterTreeBuilder.IS_NULL, null), filters.get(2));
    }

    @Test
    void between_stores_range_value() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.notBetween("price", 10, 20);

        SelectOption option = (SelectOption) builder.filters().get(0);
        assertEquals(FilterTreeBuilder.NOT_BETWEEN, option.operator());
        assertEquals(Range.of(10, 20), option.value());
    }

    @Test
    void in_snapshots_values_and_keeps_nulls() {
        List<Object> values = Arrays.asList("a", null, "c");
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.in("tag", values);
        values.set(0, "changed");

        SelectOption option = (SelectOption) builder.filters().get(0);
        assertEquals(Arrays.asList("a", null, "c"), option.value());
        @SuppressWarnings("unchecked")
        List<Object> stored = (List<Object>) option.value();
        assertThrows(UnsupportedOperationException.class, () -> stored.add("d"));
    }

    @Test
    void ignore_case_is_appended_to_operator() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.notStartsWithIgnoreCase("title", "the");

        SelectOption option = (SelectOption) builder.filters().get(0);
        assertEquals("NOT STARTS WITH IGNORE CASE", option.operator());
    }

    @Test
    void group_collects_nested_calls() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.equalTo("a", 1)
            .group(g -> g.orContains("title", "x").orContains("description", "x"));

        assertEquals("a = 1 AND (title CONTAINS x OR description CONTAINS x)", builder.toString());
        GroupOption group = (GroupOption) builder.filters().get(1);
        assertEquals(Conjunction.AND, group.conjunction());
        assertEquals(2, group.filters().size());
    }

    @Test
    void empty_group_is_dropped() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.orGroup(g -> { });

        assertTrue(builder.isEmpty());
    }

    @Test
    void applyIf_false_does_not_run_functions() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        ConditionBuilder result = builder.applyIf(false, b -> b.equalTo("x", 1));

        assertSame(builder, result);
        assertTrue(builder.isEmpty());
    }

    @Test
    void apply_runs_functions_in_order() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.apply(b -> b.equalTo("x", 1), b -> b.lessThan("y", 2));

        assertEquals("x = 1 AND y < 2", builder.toString());
    }

    @Test
    void filters_view_is_unmodifiable() {
        FilterTreeBuilder builder = new FilterTreeBuilder();
        builder.equalTo("x", 1);

        assertThrows(UnsupportedOperationException.class, () -> builder.filters().clear());
    }
}
