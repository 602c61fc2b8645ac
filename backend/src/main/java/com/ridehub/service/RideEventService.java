package com.ridehub.service;

import java.time.Clock;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ridehub.dto.RideEventRequest;
import com.ridehub.dto.RideEventResponse;
import com.ridehub.entity.Ride;
import com.ridehub.entity.RideEvent;
import com.ridehub.exception.CapacityExceededException;
import com.ridehub.exception.NotFoundException;
import com.ridehub.exception.ValidationException;
import com.ridehub.repository.RideEventRepository;
import com.ridehub.repository.RideRepository;

@Service
public class RideEventService {
    private static final Logger logger = LoggerFactory.getLogger(RideEventService.class);

    private final RideEventRepository rideEventRepository;
    private final RideRepository rideRepository;
    private final RideActivityPublisher activityPublisher;
    private final Clock clock;
    private final long maxEventsPerRide;

    public RideEventService(RideEventRepository rideEventRepository, RideRepository rideRepository,
                            RideActivityPublisher activityPublisher, Clock clock,
                            @Value("${ridehub.events.max-per-ride:1000}") long maxEventsPerRide) {
        this.rideEventRepository = rideEventRepository;
        this.rideRepository = rideRepository;
        this.activityPublisher = activityPublisher;
        this.clock = clock;
        this.maxEventsPerRide = maxEventsPerRide;
    }

    /**
     * Appends an event to a ride. The ride row stays locked until commit, so
     * concurrent appenders see each other's inserts when they count.
     */
    @Transactional
    public RideEventResponse appendEvent(Long rideId, String description) {
        Ride ride = rideRepository.findByIdForUpdate(rideId)
                .orElseThrow(() -> NotFoundException.of("Ride", rideId));
        String text = normalizeDescription(description);
        long count = rideEventRepository.countByRideId(rideId);
        if (count >= maxEventsPerRide) {
            logger.warn("Rejected event for ride {}: {} events already recorded", rideId, count);
            throw new CapacityExceededException(
                    "Ride " + rideId + " already has the maximum of " + maxEventsPerRide + " events");
        }
        RideEvent saved = rideEventRepository.save(new RideEvent(ride, text, clock.instant()));
        logger.info("Ride event added: ID={}, rideId={}", saved.getId(), rideId);
        AfterCommit.run(() -> activityPublisher.eventAppended(saved));
        return RideEventResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public Page<RideEventResponse> listEvents(Long rideId, String search, String ordering, Pageable pageable) {
        Specification<RideEvent> spec = Specification.where(null);
        if (rideId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("ride").get("id"), rideId));
        }
        if (search != null && !search.isBlank()) {
            String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, query, cb) -> cb.like(cb.lower(root.get("description")), pattern));
        }
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), eventSort(ordering));
        return rideEventRepository.findAll(spec, sorted).map(RideEventResponse::from);
    }

    @Transactional(readOnly = true)
    public RideEventResponse getEvent(Long id) {
        return RideEventResponse.from(findEvent(id));
    }

    /** Only the description can change; the creation time and owning ride are fixed. */
    @Transactional
    public RideEventResponse updateEvent(Long id, RideEventRequest request) {
        RideEvent event = findEvent(id);
        if (request.getRideId() != null && !request.getRideId().equals(event.getRide().getId())) {
            throw new ValidationException("rideId", "The ride of an event cannot be changed.");
        }
        if (request.getDescription() != null) {
            event.setDescription(normalizeDescription(request.getDescription()));
        }
        RideEvent saved = rideEventRepository.save(event);
        logger.info("Ride event updated: ID={}", id);
        return RideEventResponse.from(saved);
    }

    @Transactional
    public void deleteEvent(Long id) {
        RideEvent event = findEvent(id);
        rideEventRepository.delete(event);
        logger.info("Ride event deleted: ID={}", id);
    }

    private RideEvent findEvent(Long id) {
        return rideEventRepository.findById(id).orElseThrow(() -> NotFoundException.of("Ride event", id));
    }

    static String normalizeDescription(String description) {
        String text = description == null ? "" : description.trim();
        if (text.isEmpty()) {
            throw new ValidationException("description", "Description must not be blank.");
        }
        if (text.length() > RideEvent.DESCRIPTION_MAX_LENGTH) {
            throw new ValidationException("description",
                    "Description must be at most " + RideEvent.DESCRIPTION_MAX_LENGTH + " characters.");
        }
        return text;
    }

    private static Sort eventSort(String ordering) {
        String value = ordering == null ? "" : ordering.trim();
        switch (value) {
            case "createdAt":
            case "created_at":
                return Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));
            case "id":
                return Sort.by(Sort.Order.asc("id"));
            case "-id":
                return Sort.by(Sort.Order.desc("id"));
            default:
                return Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
        }
    }
}
