package com.ridehub.service;

import java.time.Instant;

import com.ridehub.dto.RideRequest;
import com.ridehub.entity.Ride;

/**
 * Prospective state of a ride after a mutation, before anything is written.
 * Fields left null are missing.
 */
public class RideDraft {
    private String status;
    private Long riderId;
    private Long driverId;
    private Double pickupLatitude;
    private Double pickupLongitude;
    private Double dropoffLatitude;
    private Double dropoffLongitude;
    private Instant pickupTime;

    public static RideDraft of(RideRequest request) {
        return new RideDraft().overlay(request);
    }

    public static RideDraft of(Ride ride) {
        RideDraft draft = new RideDraft();
        draft.status = ride.getStatus();
        draft.riderId = ride.getRider().getId();
        draft.driverId = ride.getDriver().getId();
        draft.pickupLatitude = ride.getPickupLatitude();
        draft.pickupLongitude = ride.getPickupLongitude();
        draft.dropoffLatitude = ride.getDropoffLatitude();
        draft.dropoffLongitude = ride.getDropoffLongitude();
        draft.pickupTime = ride.getPickupTime();
        return draft;
    }

    /** Copies every non-null field of the request over this draft. */
    public RideDraft overlay(RideRequest request) {
        if (request.getStatus() != null) status = request.getStatus();
        if (request.getRiderId() != null) riderId = request.getRiderId();
        if (request.getDriverId() != null) driverId = request.getDriverId();
        if (request.getPickupLatitude() != null) pickupLatitude = request.getPickupLatitude();
        if (request.getPickupLongitude() != null) pickupLongitude = request.getPickupLongitude();
        if (request.getDropoffLatitude() != null) dropoffLatitude = request.getDropoffLatitude();
        if (request.getDropoffLongitude() != null) dropoffLongitude = request.getDropoffLongitude();
        if (request.getPickupTime() != null) pickupTime = request.getPickupTime();
        return this;
    }

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
