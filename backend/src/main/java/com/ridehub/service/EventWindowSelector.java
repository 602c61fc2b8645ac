package com.ridehub.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.ridehub.dto.RideEventResponse;
import com.ridehub.entity.RideEvent;
import com.ridehub.repository.RideEventRepository;

/**
 * Bounds the events attached to listed rides to a rolling window ending at the
 * request instant. Detail views use {@link #fullHistory(Long)} instead.
 */
@Component
public class EventWindowSelector {

    private final RideEventRepository rideEventRepository;
    private final Duration window;

    public EventWindowSelector(RideEventRepository rideEventRepository,
                               @Value("${ridehub.events.window-hours:24}") long windowHours) {
        this.rideEventRepository = rideEventRepository;
        this.window = Duration.ofHours(windowHours);
    }

    public Instant cutoff(Instant now) {
        return now.minus(window);
    }

    /**
     * One round-trip for all given rides. Every requested id is present in the
     * result, mapped to its recent events newest first (possibly none).
     */
    public Map<Long, List<RideEventResponse>> selectRecent(Collection<Long> rideIds, Instant now) {
        Map<Long, List<RideEventResponse>> byRide = new LinkedHashMap<>();
        if (rideIds.isEmpty()) {
            return byRide;
        }
        Map<Long, List<RideEventResponse>> found = rideEventRepository.findRecentByRideIds(rideIds, cutoff(now))
                .stream()
                .map(RideEventResponse::from)
                .collect(Collectors.groupingBy(RideEventResponse::getRideId, Collectors.toList()));
        for (Long id : rideIds) {
            byRide.put(id, found.getOrDefault(id, Collections.emptyList()));
        }
        return byRide;
    }

    public List<RideEventResponse> fullHistory(Long rideId) {
        List<RideEvent> events = rideEventRepository.findByRideIdOrderByCreatedAtDescIdDesc(rideId);
        return events.stream().map(RideEventResponse::from).collect(Collectors.toList());
    }
}
