package com.ridehub.dto;

import java.util.List;

import com.ridehub.entity.Ride;

public class RideListView extends RideView {
    private final List<RideEventResponse> todaysRideEvents;
    // km from the query point; null when the listing had no usable geolocation
    private final Double distanceToPickup;

    public RideListView(Ride ride, List<RideEventResponse> todaysRideEvents, Double distanceToPickup) {
        super(ride);
        this.todaysRideEvents = todaysRideEvents;
        this.distanceToPickup = distanceToPickup;
    }

    public List<RideEventResponse> getTodaysRideEvents() { return todaysRideEvents; }
    public Double getDistanceToPickup() { return distanceToPickup; }
}
