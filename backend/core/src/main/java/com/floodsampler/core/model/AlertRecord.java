package com.floodsampler.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record AlertRecord(
        String id,
        String office,
        String event,
        String areaDescription,
        AlertSeverity severity,
        Instant onset,
        Instant expires,
        List<GeoPoint> geometry,
        double areaSqMiles
) {
    private static final double SQ_MILES_TO_SQ_KM = 2.589988;

    public AlertRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(onset, "onset is required");
        geometry = geometry == null ? List.of() : List.copyOf(geometry);
        if (geometry.isEmpty()) {
            throw new IllegalArgumentException("Alert " + id + " has no geometry");
        }
        if (expires == null || expires.isBefore(onset)) {
            expires = onset;
        }
    }

    public GeoPoint representativePoint() {
        if (geometry.size() == 1) {
            return geometry.get(0);
        }
        double lat = 0.0;
        double lon = 0.0;
        for (GeoPoint point : geometry) {
            lat += point.lat();
            lon += point.lon();
        }
        return new GeoPoint(lat / geometry.size(), lon / geometry.size());
    }

    public double extentRadiusKm() {
        if (areaSqMiles <= 0.0) {
            return 0.0;
        }
        return Math.sqrt(areaSqMiles * SQ_MILES_TO_SQ_KM / Math.PI);
    }
}
