package com.ridehub.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ridehub.dto.RideDetailView;
import com.ridehub.dto.RideRequest;
import com.ridehub.entity.Ride;
import com.ridehub.exception.NotFoundException;
import com.ridehub.repository.RideEventRepository;
import com.ridehub.repository.RideRepository;

@Service
public class RideService {
    private static final Logger logger = LoggerFactory.getLogger(RideService.class);

    private final RideRepository rideRepository;
    private final RideEventRepository rideEventRepository;
    private final RideValidator rideValidator;
    private final EventWindowSelector eventWindowSelector;
    private final RideActivityPublisher activityPublisher;

    public RideService(RideRepository rideRepository, RideEventRepository rideEventRepository,
                       RideValidator rideValidator, EventWindowSelector eventWindowSelector,
                       RideActivityPublisher activityPublisher) {
        this.rideRepository = rideRepository;
        this.rideEventRepository = rideEventRepository;
        this.rideValidator = rideValidator;
        this.eventWindowSelector = eventWindowSelector;
        this.activityPublisher = activityPublisher;
    }

    @Transactional(readOnly = true)
    public RideDetailView getRide(Long id) {
        Ride ride = rideRepository.findWithParticipantsById(id)
                .orElseThrow(() -> NotFoundException.of("Ride", id));
        return new RideDetailView(ride, eventWindowSelector.fullHistory(id));
    }

    @Transactional
    public RideDetailView createRide(RideRequest request) {
        ValidatedRide validated = rideValidator.validate(RideDraft.of(request), true);
        Ride saved = rideRepository.save(validated.applyTo(new Ride()));
        logger.info("Ride created: ID={}, rider={}, driver={}", saved.getId(),
                validated.getRider().getId(), validated.getDriver().getId());
        AfterCommit.run(() -> activityPublisher.rideCreated(saved));
        return new RideDetailView(saved, List.of());
    }

    /** Full update: the request alone must describe a valid ride. */
    @Transactional
    public RideDetailView replaceRide(Long id, RideRequest request) {
        Ride ride = rideRepository.findById(id).orElseThrow(() -> NotFoundException.of("Ride", id));
        ValidatedRide validated = rideValidator.validate(RideDraft.of(request), pickupTimeChanged(ride, request));
        return saveUpdate(validated.applyTo(ride));
    }

    /** Partial update: the request is merged over the stored ride before validation. */
    @Transactional
    public RideDetailView updateRide(Long id, RideRequest request) {
        Ride ride = rideRepository.findById(id).orElseThrow(() -> NotFoundException.of("Ride", id));
        RideDraft draft = RideDraft.of(ride).overlay(request);
        ValidatedRide validated = rideValidator.validate(draft, pickupTimeChanged(ride, request));
        return saveUpdate(validated.applyTo(ride));
    }

    @Transactional
    public void deleteRide(Long id) {
        if (!rideRepository.existsById(id)) {
            throw NotFoundException.of("Ride", id);
        }
        int events = rideEventRepository.deleteByRideIdIn(List.of(id));
        rideRepository.deleteAllByIdIn(List.of(id));
        logger.info("Ride deleted: ID={}, events removed={}", id, events);
        AfterCommit.run(() -> activityPublisher.rideDeleted(id));
    }

    private RideDetailView saveUpdate(Ride ride) {
        Ride saved = rideRepository.save(ride);
        logger.info("Ride updated: ID={}, status={}", saved.getId(), saved.getStatus());
        AfterCommit.run(() -> activityPublisher.rideUpdated(saved));
        return new RideDetailView(saved, eventWindowSelector.fullHistory(saved.getId()));
    }

    // A stored pickup time that has merely aged is not re-checked
    private static boolean pickupTimeChanged(Ride ride, RideRequest request) {
        return request.getPickupTime() != null && !request.getPickupTime().equals(ride.getPickupTime());
    }
}
