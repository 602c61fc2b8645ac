package com.ridehub.dto;

import java.util.List;

import com.ridehub.entity.Ride;

public class RideDetailView extends RideView {
    private final List<RideEventResponse> rideEvents;

    public RideDetailView(Ride ride, List<RideEventResponse> rideEvents) {
        super(ride);
        this.rideEvents = rideEvents;
    }

    public List<RideEventResponse> getRideEvents() { return rideEvents; }
}
