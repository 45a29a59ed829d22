package io.github.flameyossnowy.sift.api.range;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RangeTest {

    @Test
    void contains_is_inclusive_on_both_ends() {
        Range<Integer> range = Range.of(1, 10);

        assertTrue(Range.contains(range, 1));
        assertTrue(Range.contains(range, 10));
        assertFalse(Range.contains(range, 0));
        assertFalse(Range.contains(range, 11));
    }

    @Test
    void null_endpoint_is_open() {
        Range<LocalDate> since = Range.of(LocalDate.of(2024, 1, 1), null);

        assertTrue(Range.contains(since, LocalDate.of(2999, 1, 1)));
        assertFalse(Range.contains(since, LocalDate.of(2023, 12, 31)));
    }
}
