package com.floodsampler.core.model;

import com.floodsampler.core.util.GeoUtils;

public record BoundingBox(double minLat, double minLon, double maxLat, double maxLon) {
    public BoundingBox {
        if (minLat > maxLat || minLon > maxLon) {
            throw new IllegalArgumentException("Bounding box corners are inverted: "
                    + minLat + "," + minLon + " / " + maxLat + "," + maxLon);
        }
    }

    public static BoundingBox around(GeoPoint center, double halfExtentKm) {
        double dLat = halfExtentKm / GeoUtils.KM_PER_DEGREE_LAT;
        double cos = Math.max(0.01, Math.cos(Math.toRadians(center.lat())));
        double dLon = halfExtentKm / (GeoUtils.KM_PER_DEGREE_LAT * cos);
        return new BoundingBox(
                Math.max(-90.0, center.lat() - dLat),
                Math.max(-180.0, center.lon() - dLon),
                Math.min(90.0, center.lat() + dLat),
                Math.min(180.0, center.lon() + dLon)
        );
    }

    public boolean contains(GeoPoint point) {
        return point.lat() >= minLat && point.lat() <= maxLat
                && point.lon() >= minLon && point.lon() <= maxLon;
    }

    public String toQueryParam() {
        return minLon + "," + minLat + "," + maxLon + "," + maxLat;
    }
}
