package com.ridehub.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ridehub.dto.RideEventResponse;
import com.ridehub.dto.RideListView;
import com.ridehub.entity.Ride;
import com.ridehub.repository.RidePickup;
import com.ridehub.repository.RideRepository;

/**
 * Read path for ride listings: filters, ordering (including by distance from a
 * query point), pagination and the windowed event prefetch. Three storage
 * round-trips per call regardless of page size.
 */
@Service
public class RideQueryComposer {
    private static final Logger logger = LoggerFactory.getLogger(RideQueryComposer.class);

    private final RideRepository rideRepository;
    private final EventWindowSelector eventWindowSelector;
    private final Clock clock;

    public RideQueryComposer(RideRepository rideRepository, EventWindowSelector eventWindowSelector, Clock clock) {
        this.rideRepository = rideRepository;
        this.eventWindowSelector = eventWindowSelector;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Page<RideListView> list(RideQuery query, Pageable pageable) {
        Instant now = clock.instant();
        Specification<Ride> filter = RideSpecifications.matching(query);
        logger.debug("Listing rides: {} page={} size={}", query, pageable.getPageNumber(), pageable.getPageSize());
        if (query.getOrdering().isDistance()) {
            return listByDistance(query, filter, pageable, now);
        }
        if (pageable.getOffset() > Integer.MAX_VALUE) {
            // past any reachable row; JPA cannot express the offset
            return new PageImpl<>(List.of(), pageable, rideRepository.count(filter));
        }
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), query.getOrdering().toSort());
        Page<Ride> rides = rideRepository.findAll(filter.and(RideSpecifications.fetchParticipants()), sorted);
        Map<Long, List<RideEventResponse>> events = eventWindowSelector.selectRecent(
                rides.getContent().stream().map(Ride::getId).collect(Collectors.toList()), now);
        Optional<GeoPoint> point = query.getPoint();
        return rides.map(ride -> new RideListView(ride, events.get(ride.getId()),
                point.map(p -> DistanceCalculator.distanceKm(p, ride.getPickupLatitude(), ride.getPickupLongitude()))
                        .orElse(null)));
    }

    private Page<RideListView> listByDistance(RideQuery query, Specification<Ride> filter, Pageable pageable, Instant now) {
        GeoPoint point = query.getPoint().orElseThrow();
        List<RankedPickup> ranked = new ArrayList<>();
        for (RidePickup pickup : rideRepository.findPickups(filter)) {
            ranked.add(new RankedPickup(pickup.getId(),
                    DistanceCalculator.distanceKm(point, pickup.getLatitude(), pickup.getLongitude())));
        }
        Comparator<RankedPickup> byDistance = Comparator.comparingDouble(RankedPickup::distance);
        if (query.getOrdering() == RideOrdering.DISTANCE_DESC) {
            byDistance = byDistance.reversed();
        }
        ranked.sort(byDistance.thenComparing(RankedPickup::id));

        int from = (int) Math.min(pageable.getOffset(), ranked.size());
        int to = Math.min(from + pageable.getPageSize(), ranked.size());
        List<RankedPickup> slice = ranked.subList(from, to);
        if (slice.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, ranked.size());
        }

        List<Long> ids = slice.stream().map(RankedPickup::id).collect(Collectors.toList());
        Map<Long, Ride> rides = rideRepository.findAllWithParticipantsByIdIn(ids).stream()
                .collect(Collectors.toMap(Ride::getId, Function.identity()));
        Map<Long, List<RideEventResponse>> events = eventWindowSelector.selectRecent(ids, now);

        List<RideListView> views = new ArrayList<>(slice.size());
        for (RankedPickup pickup : slice) {
            Ride ride = rides.get(pickup.id());
            // deleted between the two reads
            if (ride != null) {
                views.add(new RideListView(ride, events.get(pickup.id()), pickup.distance()));
            }
        }
        return new PageImpl<>(views, pageable, ranked.size());
    }

    private static final class RankedPickup {
        private final Long id;
        private final double distance;

        RankedPickup(Long id, double distance) {
            this.id = id;
            this.distance = distance;
        }

        Long id() { return id; }
        double distance() { return distance; }
    }
}
