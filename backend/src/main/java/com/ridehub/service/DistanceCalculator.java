package com.ridehub.service;

/**
 * Great-circle distance on a sphere of radius 6371 km, using the spherical law
 * of cosines.
 */
public final class DistanceCalculator {

    public static final double EARTH_RADIUS_KM = 6371;

    private DistanceCalculator() {
    }

    public static double distanceKm(double lat, double lon, double pickupLat, double pickupLon) {
        if (lat == pickupLat && lon == pickupLon) {
            return 0;
        }
        double lat1 = Math.toRadians(lat);
        double lat2 = Math.toRadians(pickupLat);
        double deltaLon = Math.toRadians(pickupLon) - Math.toRadians(lon);
        double cosine = Math.cos(lat1) * Math.cos(lat2) * Math.cos(deltaLon)
                + Math.sin(lat1) * Math.sin(lat2);
        // rounding can push the argument just outside [-1, 1]
        double clamped = Math.max(-1.0, Math.min(1.0, cosine));
        return EARTH_RADIUS_KM * Math.acos(clamped);
    }

    public static double distanceKm(GeoPoint from, double pickupLat, double pickupLon) {
        return distanceKm(from.getLatitude(), from.getLongitude(), pickupLat, pickupLon);
    }
}
