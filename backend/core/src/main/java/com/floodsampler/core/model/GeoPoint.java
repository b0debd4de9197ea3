package com.floodsampler.core.model;

import java.util.Comparator;

public record GeoPoint(double lat, double lon) implements Comparable<GeoPoint> {
    private static final Comparator<GeoPoint> ORDER = Comparator
            .comparingDouble(GeoPoint::lat)
            .thenComparingDouble(GeoPoint::lon);

    public GeoPoint {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude out of range: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("Longitude out of range: " + lon);
        }
    }

    @Override
    public int compareTo(GeoPoint other) {
        return ORDER.compare(this, other);
    }
}
