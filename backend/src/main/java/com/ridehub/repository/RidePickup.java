package com.ridehub.repository;

/**
 * Narrow projection of a ride used for in-memory distance ordering.
 */
public class RidePickup {
    private final Long id;
    private final double latitude;
    private final double longitude;

    public RidePickup(Long id, double latitude, double longitude) {
        this.id = id;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public Long getId() { return id; }
    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
}
