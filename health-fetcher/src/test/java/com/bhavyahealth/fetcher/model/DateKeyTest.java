package com.bhavyahealth.fetcher.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DateKeyTest {

    @Test
    void parse_IsoDate_RoundTripsToSameText() {
        DateKey key = DateKey.parse("2024-02-29");

        assertEquals(LocalDate.of(2024, 2, 29), key.date());
        assertEquals("2024-02-29", key.toString());
    }

    @Test
    void parse_BadInput_Throws() {
        assertThrows(IllegalArgumentException.class, () -> DateKey.parse("2023-02-29"));
        assertThrows(IllegalArgumentException.class, () -> DateKey.parse("01-01-2024"));
        assertThrows(IllegalArgumentException.class, () -> DateKey.parse("yesterday"));
        assertThrows(IllegalArgumentException.class, () -> DateKey.parse(null));
    }

    @Test
    void range_IsInclusiveAndAscending() {
        List<DateKey> dates = DateKey.range(DateKey.parse("2023-12-30"), DateKey.parse("2024-01-02"));

        assertEquals(List.of(
                DateKey.parse("2023-12-30"),
                DateKey.parse("2023-12-31"),
                DateKey.parse("2024-01-01"),
                DateKey.parse("2024-01-02")), dates);
    }

    @Test
    void range_SingleDay_HasOneDate() {
        DateKey day = DateKey.parse("2024-06-15");
        assertEquals(List.of(day), DateKey.range(day, day));
    }

    @Test
    void range_StartAfterEnd_IsEmpty() {
        assertTrue(DateKey.range(DateKey.parse("2024-01-03"), DateKey.parse("2024-01-01")).isEmpty());
    }

    @Test
    void ordering_FollowsCalendar() {
        DateKey earlier = DateKey.parse("2023-12-31");
        DateKey later = DateKey.parse("2024-01-01");

        assertTrue(earlier.compareTo(later) < 0);
        assertTrue(later.isAfter(earlier));
        assertFalse(earlier.isAfter(earlier));
    }
}
