package com.ridehub.dto;

import java.time.Instant;

import com.ridehub.entity.RideEvent;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RideEventResponse {
    private final Long id;
    private final Long rideId;
    private final String description;
    private final Instant createdAt;

    public static RideEventResponse from(RideEvent event) {
        return new RideEventResponse(event.getId(), event.getRide().getId(), event.getDescription(),
                event.getCreatedAt());
    }
}
