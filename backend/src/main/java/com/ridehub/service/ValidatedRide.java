package com.ridehub.service;

import com.ridehub.entity.Ride;
import com.ridehub.entity.User;

/** A draft that passed every ride rule, with its participants resolved. */
public class ValidatedRide {
    private final RideDraft draft;
    private final User rider;
    private final User driver;

    ValidatedRide(RideDraft draft, User rider, User driver) {
        this.draft = draft;
        this.rider = rider;
        this.driver = driver;
    }

    public User getRider() { return rider; }
    public User getDriver() { return driver; }

    public Ride applyTo(Ride ride) {
        ride.setStatus(draft.getStatus().trim());
        ride.setRider(rider);
        ride.setDriver(driver);
        ride.setPickupLatitude(draft.getPickupLatitude());
        ride.setPickupLongitude(draft.getPickupLongitude());
        ride.setDropoffLatitude(draft.getDropoffLatitude());
        ride.setDropoffLongitude(draft.getDropoffLongitude());
        ride.setPickupTime(draft.getPickupTime());
        return ride;
    }
}
