package com.floodsampler.core.util;

import com.floodsampler.core.model.GeoPoint;

public final class GeoUtils {
    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double KM_PER_DEGREE_LAT = 111.32;

    private GeoUtils() {
    }

    public static double haversineKm(GeoPoint a, GeoPoint b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLon = Math.toRadians(b.lon() - a.lon());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.lat())) * Math.cos(Math.toRadians(b.lat()))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    public static GeoPoint destination(GeoPoint origin, double bearingRadians, double distanceKm) {
        double angular = distanceKm / EARTH_RADIUS_KM;
        double lat1 = Math.toRadians(origin.lat());
        double lon1 = Math.toRadians(origin.lon());
        double lat2 = Math.asin(Math.sin(lat1) * Math.cos(angular)
                + Math.cos(lat1) * Math.sin(angular) * Math.cos(bearingRadians));
        double lon2 = lon1 + Math.atan2(
                Math.sin(bearingRadians) * Math.sin(angular) * Math.cos(lat1),
                Math.cos(angular) - Math.sin(lat1) * Math.sin(lat2));
        double lonDeg = Math.toDegrees(lon2);
        lonDeg = ((lonDeg + 540.0) % 360.0) - 180.0;
        double latDeg = Math.max(-90.0, Math.min(90.0, Math.toDegrees(lat2)));
        return new GeoPoint(latDeg, lonDeg);
    }
}
