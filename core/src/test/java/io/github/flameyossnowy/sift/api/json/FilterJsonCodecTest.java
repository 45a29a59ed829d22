package io.github.flameyossnowy.sift.api.json;

import io.github.flameyossnowy.sift.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.sift.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.sift.api.nullable.NullBoolean;
import io.github.flameyossnowy.sift.api.nullable.NullDate;
import io.github.flameyossnowy.sift.api.nullable.NullInteger;
import io.github.flameyossnowy.sift.api.nullable.NullString;
import io.github.flameyossnowy.sift.api.range.Range;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FilterJsonCodecTest {

    public record ProductFilter(
        NullString name,
        NullInteger stock,
        NullBoolean discontinued,
        NullDate releasedAfter,
        Range<Integer> price
    ) {}

    private final FilterJsonCodec codec = new FilterJsonCodec();

    @Test
    void zero_binds_to_present_wrapper() {
        ProductFilter filter = codec.deserialize("{\"stock\":0,\"discontinued\":false}", ProductFilter.class);

        assertTrue(filter.stock().isPresent());
        assertEquals(0, filter.stock().get());
        assertTrue(filter.discontinued().isPresent());
        assertEquals(Boolean.FALSE, filter.discontinued().get());
    }

    @Test
    void explicit_null_binds_to_absent_wrapper() {
        ProductFilter filter = codec.deserialize("{\"name\":null}", ProductFilter.class);

        assertNotNull(filter.name());
        assertFalse(filter.name().isPresent());
    }

    @Test
    void missing_record_component_binds_to_absent_wrapper() {
        ProductFilter filter = codec.deserialize("{}", ProductFilter.class);

        assertNotNull(filter.stock());
        assertFalse(filter.stock().isPresent());
        assertNull(filter.price());
    }

    @Test
    void dates_and_ranges_bind() {
        ProductFilter filter = codec.deserialize(
            "{\"releasedAfter\":\"2024-03-01\",\"price\":{\"start\":5,\"end\":50},\"page\":2}",
            ProductFilter.class
        );

        assertEquals(LocalDate.of(2024, 3, 1), filter.releasedAfter().get());
        assertEquals(Range.of(5, 50), filter.price());
    }

    @Test
    void absent_wrapper_serializes_as_null() {
        ProductFilter filter = new ProductFilter(NullString.empty(), NullInteger.of(3), null, null, null);

        String json = codec.serialize(filter);
        assertTrue(json.contains("\"name\":null"), json);
        assertTrue(json.contains("\"stock\":3"), json);
    }

    @Test
    void malformed_json_reports_location() {
        JsonProcessException e = assertThrows(JsonProcessException.class,
            () -> codec.deserialize("{\"stock\": \"many\"}", ProductFilter.class));

        assertNotNull(e.getLocation());
        assertTrue(e.getLocation().lineNumber() >= 1);
        assertTrue(e.getMessage().startsWith("Cannot bind ProductFilter"), e.getMessage());
        assertTrue(e.getMessage().contains("(line 1, column "), e.getMessage());
    }

    @Test
    void unknown_location_is_left_out_of_message() {
        JsonProcessException e = new JsonProcessException("broken", null);

        assertEquals(JsonLocation.UNKNOWN, e.getLocation());
        assertEquals("broken", e.getMessage());
    }
}
