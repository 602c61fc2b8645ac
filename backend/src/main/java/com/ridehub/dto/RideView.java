package com.ridehub.dto;

import java.time.Instant;

import com.ridehub.entity.Ride;

/**
 * Fields shared by the list and detail representations of a ride. The rider
 * and driver must already be initialized on the given ride.
 */
public abstract class RideView {
    private final Long id;
    private final String status;
    private final Long riderId;
    private final Long driverId;
    private final UserSummary riderDetails;
    private final UserSummary driverDetails;
    private final double pickupLatitude;
    private final double pickupLongitude;
    private final double dropoffLatitude;
    private final double dropoffLongitude;
    private final Instant pickupTime;

    protected RideView(Ride ride) {
        this.id = ride.getId();
        this.status = ride.getStatus();
        this.riderId = ride.getRider().getId();
        this.driverId = ride.getDriver().getId();
        this.riderDetails = UserSummary.from(ride.getRider());
        this.driverDetails = UserSummary.from(ride.getDriver());
        this.pickupLatitude = ride.getPickupLatitude();
        this.pickupLongitude = ride.getPickupLongitude();
        this.dropoffLatitude = ride.getDropoffLatitude();
        this.dropoffLongitude = ride.getDropoffLongitude();
        this.pickupTime = ride.getPickupTime();
    }

    public Long getId() { return id; }
    public String getStatus() { return status; }
    public Long getRiderId() { return riderId; }
    public Long getDriverId() { return driverId; }
    public UserSummary getRiderDetails() { return riderDetails; }
    public UserSummary getDriverDetails() { return driverDetails; }
    public double getPickupLatitude() { return pickupLatitude; }
    public double getPickupLongitude() { return pickupLongitude; }
    public double getDropoffLatitude() { return dropoffLatitude; }
    public double getDropoffLongitude() { return dropoffLongitude; }
    public Instant getPickupTime() { return pickupTime; }
}
