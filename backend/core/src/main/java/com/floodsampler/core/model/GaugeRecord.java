package com.floodsampler.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record GaugeRecord(
        String stationId,
        String name,
        GeoPoint location,
        Double floodStageFt,
        List<GaugeReading> readings
) {
    public GaugeRecord {
        Objects.requireNonNull(stationId, "stationId is required");
        Objects.requireNonNull(location, "location is required");
        readings = readings == null ? List.of() : List.copyOf(readings);
    }

    public boolean hasFloodStage() {
        return floodStageFt != null;
    }

    public List<GaugeReading> readingsBetween(Instant from, Instant to) {
        return readings.stream()
                .filter(reading -> !reading.observedAt().isBefore(from) && !reading.observedAt().isAfter(to))
                .toList();
    }
}
