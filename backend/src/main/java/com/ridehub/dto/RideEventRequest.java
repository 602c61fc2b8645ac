package com.ridehub.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public class RideEventRequest {

    @JsonAlias({"ride_id", "ride"})
    private Long rideId;

    private String description;

    public RideEventRequest() {
    }

    public RideEventRequest(Long rideId, String description) {
        this.rideId = rideId;
        this.description = description;
    }

    public Long getRideId() { return rideId; }
    public void setRideId(Long rideId) { this.rideId = rideId; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
