package com.ridehub.service;

import java.util.Optional;

public final class GeoPoint {
    private final double latitude;
    private final double longitude;

    public GeoPoint(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }

    /**
     * Parses raw query-string coordinates. Anything unusable (missing, blank,
     * non-numeric, non-finite or out of range) yields an empty result rather
     * than an error, which turns distance features off for the request.
     */
    public static Optional<GeoPoint> parse(String rawLatitude, String rawLongitude) {
        Double lat = parseCoordinate(rawLatitude, 90);
        Double lon = parseCoordinate(rawLongitude, 180);
        if (lat == null || lon == null) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(lat, lon));
    }

    private static Double parseCoordinate(String raw, double bound) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        if (!Double.isFinite(value) || value < -bound || value > bound) {
            return null;
        }
        return value;
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
