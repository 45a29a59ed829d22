package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.api.annotations.Search;
import io.github.flameyossnowy.sift.api.nullable.NullInteger;
import io.github.flameyossnowy.sift.api.nullable.NullString;
import io.github.flameyossnowy.sift.search.Condition;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ValueExtractorTest {
    private final ValueExtractor extractor = new ValueExtractor(LoggerFactory.getLogger(ValueExtractorTest.class));
    private final ConditionParser parser = new ConditionParser(LoggerFactory.getLogger(ValueExtractorTest.class));

    static class Inner {
        String code;
    }

    static class Filter {
        int count;
        NullInteger stock;
        NullString label;
        Optional<String> region;
        OptionalInt limit;
        @Search("dive")
        Inner inner;
    }

    private ResolvedValue extract(Filter filter, String column) {
        List<Condition> conditions = parser.parse(Filter.class);
        Condition condition = conditions.stream()
            .filter(c -> c.column().equals(column))
            .findFirst()
            .orElseThrow();
        return extractor.extract(condition, filter);
    }

    @Test
    void primitive_zero_is_present() {
        ResolvedValue value = extract(new Filter(), "count");

        assertTrue(value.present());
        assertEquals(0, value.value());
    }

    @Test
    void nullable_wrappers_follow_validity() {
        Filter filter = new Filter();
        filter.stock = NullInteger.of(0);
        filter.label = NullString.empty();

        assertEquals(new ResolvedValue(0, true), extract(filter, "stock"));
        assertEquals(ResolvedValue.ABSENT, extract(filter, "label"));
    }

    @Test
    void null_fields_are_absent() {
        Filter filter = new Filter();

        assertEquals(ResolvedValue.ABSENT, extract(filter, "stock"));
        assertEquals(ResolvedValue.ABSENT, extract(filter, "region"));
    }

    @Test
    void optionals_are_unwrapped() {
        Filter filter = new Filter();
        filter.region = Optional.of("eu");
        filter.limit = OptionalInt.empty();

        assertEquals(new ResolvedValue("eu", true), extract(filter, "region"));
        assertEquals(ResolvedValue.ABSENT, extract(filter, "limit"));

        filter.limit = OptionalInt.of(5);
        assertEquals(new ResolvedValue(5, true), extract(filter, "limit"));
    }

    @Test
    void null_intermediate_object_is_absent() {
        Filter filter = new Filter();
        assertEquals(ResolvedValue.ABSENT, extract(filter, "code"));

        filter.inner = new Inner();
        filter.inner.code = "X1";
        assertEquals(new ResolvedValue("X1", true), extract(filter, "code"));
    }
}
