package com.floodsampler.core.sampling;

import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Sample;
import com.floodsampler.core.util.GeoUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class ExclusionIndex {
    private static final double KM_PER_DEGREE = GeoUtils.EARTH_RADIUS_KM * Math.PI / 180.0;

    private final double radiusKm;
    private final Duration window;
    private final double cellDegrees;
    private final long bucketSeconds;
    private final Map<Cell, List<Sample>> cells;

    private ExclusionIndex(double radiusKm, Duration window, Map<Cell, List<Sample>> cells) {
        this.radiusKm = radiusKm;
        this.window = window;
        this.cellDegrees = cellDegrees(radiusKm);
        this.bucketSeconds = bucketSeconds(window);
        this.cells = cells;
    }

    public static ExclusionIndex build(Collection<Sample> positives, double radiusKm, Duration window) {
        if (radiusKm <= 0.0) {
            throw new IllegalArgumentException("Exclusion radius must be positive, got: " + radiusKm);
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Exclusion window must be positive, got: " + window);
        }
        double cellDegrees = cellDegrees(radiusKm);
        long bucketSeconds = bucketSeconds(window);
        Map<Cell, List<Sample>> cells = new HashMap<>();
        for (Sample positive : positives) {
            Cell cell = cellOf(positive.location(), positive.timestamp(), cellDegrees, bucketSeconds);
            cells.computeIfAbsent(cell, ignored -> new ArrayList<>()).add(positive);
        }
        return new ExclusionIndex(radiusKm, window, Map.copyOf(cells));
    }

    public boolean isExcluded(GeoPoint point, Instant time) {
        return !scan(point, time, true).isEmpty();
    }

    public List<Sample> conflicts(GeoPoint point, Instant time) {
        return scan(point, time, false);
    }

    private List<Sample> scan(GeoPoint point, Instant time, boolean firstOnly) {
        double latSpan = radiusKm / KM_PER_DEGREE;
        double lonSpan = lonSpanDegrees(point.lat(), latSpan);
        long latFrom = index(point.lat() - latSpan, cellDegrees);
        long latTo = index(point.lat() + latSpan, cellDegrees);
        long lonFrom = index(Math.max(-180.0, point.lon() - lonSpan), cellDegrees);
        long lonTo = index(Math.min(180.0, point.lon() + lonSpan), cellDegrees);
        long bucket = Math.floorDiv(time.getEpochSecond(), bucketSeconds);

        List<Sample> hits = new ArrayList<>();
        for (long t = bucket - 1; t <= bucket + 1; t++) {
            for (long la = latFrom; la <= latTo; la++) {
                for (long lo = lonFrom; lo <= lonTo; lo++) {
                    List<Sample> members = cells.get(new Cell(la, lo, t));
                    if (members == null) {
                        continue;
                    }
                    for (Sample member : members) {
                        if (within(member, point, time)) {
                            hits.add(member);
                            if (firstOnly) {
                                return hits;
                            }
                        }
                    }
                }
            }
        }
        return hits;
    }

    private boolean within(Sample positive, GeoPoint point, Instant time) {
        Duration gap = Duration.between(positive.timestamp(), time).abs();
        return gap.compareTo(window) <= 0 && GeoUtils.haversineKm(positive.location(), point) <= radiusKm;
    }

    // widest longitude difference two points within radiusKm can have, given the highest latitude either can reach
    private double lonSpanDegrees(double lat, double latSpan) {
        double maxAbsLat = Math.min(90.0, Math.abs(lat) + latSpan);
        double cos = Math.cos(Math.toRadians(maxAbsLat));
        double ratio = Math.sin(radiusKm / (2.0 * GeoUtils.EARTH_RADIUS_KM)) / Math.max(cos, 1e-12);
        if (ratio >= 1.0) {
            return 360.0;
        }
        return Math.toDegrees(2.0 * Math.asin(ratio));
    }

    private static Cell cellOf(GeoPoint point, Instant time, double cellDegrees, long bucketSeconds) {
        return new Cell(
                index(point.lat(), cellDegrees),
                index(point.lon(), cellDegrees),
                Math.floorDiv(time.getEpochSecond(), bucketSeconds)
        );
    }

    private static long index(double degrees, double cellDegrees) {
        return (long) Math.floor(degrees / cellDegrees);
    }

    private static double cellDegrees(double radiusKm) {
        return radiusKm / KM_PER_DEGREE;
    }

    private static long bucketSeconds(Duration window) {
        return Math.max(1L, window.getSeconds() + (window.getNano() > 0 ? 1 : 0));
    }

    private record Cell(long lat, long lon, long bucket) {
    }
}
