package com.floodsampler.core.model;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeWindowTest {
    private static final Clock OCTOBER = Clock.fixed(Instant.parse("2026-10-17T15:30:00Z"), ZoneOffset.UTC);

    @Test
    void buildsOneSubIntervalPerYearCoveringLeadingMonths() {
        TimeWindow window = TimeWindow.lastYears(2, 3, OCTOBER);

        assertEquals(List.of(
                interval("2024-01-01T00:00:00Z", "2024-04-01T00:00:00Z"),
                interval("2025-01-01T00:00:00Z", "2025-04-01T00:00:00Z"),
                interval("2026-01-01T00:00:00Z", "2026-04-01T00:00:00Z")
        ), window.intervals());
    }

    @Test
    void currentYearStopsAtStartOfToday() {
        TimeWindow window = TimeWindow.lastYears(1, 12, OCTOBER);

        assertEquals(List.of(
                interval("2025-01-01T00:00:00Z", "2026-01-01T00:00:00Z"),
                interval("2026-01-01T00:00:00Z", "2026-10-17T00:00:00Z")
        ), window.intervals());
    }

    @Test
    void emptyCurrentYearIsOmitted() {
        Clock newYearsDay = Clock.fixed(Instant.parse("2026-01-01T08:00:00Z"), ZoneOffset.UTC);

        TimeWindow window = TimeWindow.lastYears(1, 2, newYearsDay);

        assertEquals(List.of(interval("2025-01-01T00:00:00Z", "2025-03-01T00:00:00Z")), window.intervals());
    }

    @Test
    void subIntervalsAreHalfOpen() {
        TimeWindow window = TimeWindow.lastYears(1, 3, OCTOBER);

        assertTrue(window.contains(Instant.parse("2025-01-01T00:00:00Z")));
        assertTrue(window.contains(Instant.parse("2025-03-31T23:59:59Z")));
        assertFalse(window.contains(Instant.parse("2025-04-01T00:00:00Z")));
        assertFalse(window.contains(Instant.parse("2025-07-01T00:00:00Z")));
    }

    @Test
    void rejectsOutOfRangeArguments() {
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.lastYears(0, 12, OCTOBER));
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.lastYears(4, 12, OCTOBER));
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.lastYears(2, 0, OCTOBER));
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.lastYears(2, 13, OCTOBER));
    }

    @Test
    void rejectsOverlappingSubIntervalsButKeepsAdjacentOnesSeparate() {
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.of(
                interval("2025-01-01T00:00:00Z", "2025-03-01T00:00:00Z"),
                interval("2025-02-01T00:00:00Z", "2025-04-01T00:00:00Z")
        ));

        TimeWindow adjacent = TimeWindow.of(
                interval("2025-02-01T00:00:00Z", "2025-03-01T00:00:00Z"),
                interval("2025-01-01T00:00:00Z", "2025-02-01T00:00:00Z")
        );
        assertEquals(2, adjacent.intervals().size());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), adjacent.intervals().get(0).start());
    }

    private static TimeInterval interval(String start, String end) {
        return new TimeInterval(Instant.parse(start), Instant.parse(end));
    }
}
