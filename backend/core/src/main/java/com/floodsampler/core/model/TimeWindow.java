package com.floodsampler.core.model;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class TimeWindow {
    public static final int MAX_YEARS = 3;

    private final List<TimeInterval> intervals;

    public TimeWindow(List<TimeInterval> intervals) {
        Objects.requireNonNull(intervals, "intervals are required");
        List<TimeInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(null);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).overlaps(sorted.get(i))) {
                throw new IllegalArgumentException("Overlapping sub-intervals: " + sorted.get(i - 1) + " and " + sorted.get(i));
            }
        }
        this.intervals = List.copyOf(sorted);
    }

    public static TimeWindow of(TimeInterval... intervals) {
        return new TimeWindow(List.of(intervals));
    }

    public static TimeWindow lastYears(int years, int months, Clock clock) {
        if (years < 1 || years > MAX_YEARS) {
            throw new IllegalArgumentException("Years must be between 1 and " + MAX_YEARS + ", got: " + years);
        }
        if (months < 1 || months > 12) {
            throw new IllegalArgumentException("Months must be between 1 and 12, got: " + months);
        }
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        Instant startOfToday = today.atStartOfDay(ZoneOffset.UTC).toInstant();
        List<TimeInterval> intervals = new ArrayList<>();
        for (int year = today.getYear() - years; year <= today.getYear(); year++) {
            Instant start = LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
            Instant end = LocalDate.of(year, 1, 1).plusMonths(months).atStartOfDay(ZoneOffset.UTC).toInstant();
            if (end.isAfter(startOfToday)) {
                end = startOfToday;
            }
            if (end.isAfter(start)) {
                intervals.add(new TimeInterval(start, end));
            }
        }
        return new TimeWindow(intervals);
    }

    public List<TimeInterval> intervals() {
        return intervals;
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public boolean contains(Instant instant) {
        for (TimeInterval interval : intervals) {
            if (interval.contains(instant)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TimeWindow other && intervals.equals(other.intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    @Override
    public String toString() {
        return "TimeWindow" + intervals;
    }
}
