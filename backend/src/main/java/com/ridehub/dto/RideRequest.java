package com.ridehub.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Ride create/update body. Every field is boxed so a partial update can tell
 * an absent field from a supplied one.
 */
public class RideRequest {
    private String status;

    @JsonAlias({"rider_id", "rider"})
    private Long riderId;

    @JsonAlias({"driver_id", "driver"})
    private Long driverId;

    @JsonAlias("pickup_latitude")
    private Double pickupLatitude;

    @JsonAlias("pickup_longitude")
    private Double pickupLongitude;

    @JsonAlias("dropoff_latitude")
    private Double dropoffLatitude;

    @JsonAlias("dropoff_longitude")
    private Double dropoffLongitude;

    @JsonAlias("pickup_time")
    private Instant pickupTime;

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public Long getRiderId() { return riderId; }
    public void setRiderId(Long riderId) { this.riderId = riderId; }
    public Long getDriverId() { return driverId; }
    public void setDriverId(Long driverId) { this.driverId = driverId; }
    public Double getPickupLatitude() { return pickupLatitude; }
    public void setPickupLatitude(Double pickupLatitude) { this.pickupLatitude = pickupLatitude; }
    public Double getPickupLongitude() { return pickupLongitude; }
    public void setPickupLongitude(Double pickupLongitude) { this.pickupLongitude = pickupLongitude; }
    public Double getDropoffLatitude() { return dropoffLatitude; }
    public void setDropoffLatitude(Double dropoffLatitude) { this.dropoffLatitude = dropoffLatitude; }
    public Double getDropoffLongitude() { return dropoffLongitude; }
    public void setDropoffLongitude(Double dropoffLongitude) { this.dropoffLongitude = dropoffLongitude; }
    public Instant getPickupTime() { return pickupTime; }
    public void setPickupTime(Instant pickupTime) { this.pickupTime = pickupTime; }
}
