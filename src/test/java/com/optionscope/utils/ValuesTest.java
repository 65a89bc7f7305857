package com.optionscope.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ValuesTest {

    @Test
    void parseDouble_shouldTreatMissingMarkersAsNull() {
        assertEquals(1234.5, Values.parseDouble(" 1,234.5 "), 1e-9);
        assertEquals(-0.25, Values.parseDouble("-0.25"), 1e-9);
        assertNull(Values.parseDouble(null));
        assertNull(Values.parseDouble(""));
        assertNull(Values.parseDouble("NaN"));
        assertNull(Values.parseDouble("None"));
        assertNull(Values.parseDouble("Infinity"));
        assertNull(Values.parseDouble("12abc"));
    }

    @Test
    void parseDate_shouldAcceptCommonSpellings() {
        LocalDate expected = LocalDate.of(2024, 1, 19);
        assertEquals(expected, Values.parseDate("2024-01-19"));
        assertEquals(expected, Values.parseDate("20240119"));
        assertEquals(expected, Values.parseDate("2024/01/19"));
        assertEquals(expected, Values.parseDate("1/19/2024"));
        assertEquals(expected, Values.parseDate("2024-01-19 00:00:00"));
        assertEquals(expected, Values.parseDate("2024-01-19T16:00:00"));
        assertEquals(expected, Values.parseDate("2024-01-19T16:00:00-05:00"));
        assertNull(Values.parseDate("19 Jan"));
        assertNull(Values.parseDate("   "));
    }

    @Test
    void parseDateTime_shouldKeepTimeOfDay() {
        assertEquals(LocalDateTime.of(2024, 1, 10, 9, 30, 1),
                Values.parseDateTime("2024-01-10 09:30:01"));
        assertEquals(LocalDateTime.of(2024, 1, 10, 9, 30),
                Values.parseDateTime("2024-01-10 09:30"));
        assertEquals(LocalDateTime.of(2024, 1, 10, 14, 30),
                Values.parseDateTime("2024-01-10T14:30:00Z"));
        assertEquals(LocalDateTime.of(2024, 1, 10, 0, 0),
                Values.parseDateTime("2024-01-10"));
        assertNull(Values.parseDateTime("later"));
    }

    @Test
    void text_shouldTrimToNull() {
        assertEquals("abc", Values.text("  abc "));
        assertNull(Values.text(" \t "));
    }
}
