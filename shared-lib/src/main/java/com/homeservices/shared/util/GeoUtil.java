package com.homeservices.shared.util;

/**
 * Great-circle distance helpers.
 */
public final class GeoUtil {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtil() {}

    /**
     * Haversine distance in kilometres between two points given in decimal degrees.
     * Symmetric, and exactly zero for identical points.
     */
    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90.0 && lat <= 90.0;
    }

    public static boolean isValidLongitude(double lng) {
        return lng >= -180.0 && lng <= 180.0;
    }
}
