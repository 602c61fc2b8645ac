package com.ridehub.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ridehub.entity.Ride;
import com.ridehub.entity.User;
import com.ridehub.exception.NotFoundException;
import com.ridehub.exception.ValidationException;
import com.ridehub.repository.UserRepository;

/**
 * Checks a merged ride draft against every ride rule. Structural problems are
 * collected and reported together; participant lookups only happen once the
 * draft is structurally sound.
 */
@Component
public class RideValidator {

    static final double SAME_POINT_TOLERANCE_DEG = 0.00001;
    static final Duration PICKUP_TIME_GRACE = Duration.ofMinutes(5);
    static final String REQUIRED = "This field is required.";

    private final UserRepository userRepository;
    private final Clock clock;

    public RideValidator(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * @param checkPickupTime whether the pickup time came with this mutation and
     *                        must not lie too far in the past
     */
    public ValidatedRide validate(RideDraft draft, boolean checkPickupTime) {
        Map<String, List<String>> errors = new LinkedHashMap<>();

        String status = draft.getStatus();
        if (status == null) {
            add(errors, "status", REQUIRED);
        } else if (status.isBlank()) {
            add(errors, "status", "Status must not be blank.");
        } else if (status.trim().length() > Ride.STATUS_MAX_LENGTH) {
            add(errors, "status", "Status must be at most " + Ride.STATUS_MAX_LENGTH + " characters.");
        }

        if (draft.getRiderId() == null) {
            add(errors, "rider", REQUIRED);
        }
        if (draft.getDriverId() == null) {
            add(errors, "driver", REQUIRED);
        }
        if (draft.getRiderId() != null && draft.getRiderId().equals(draft.getDriverId())) {
            add(errors, "driver", "Rider and driver must be different users.");
        }

        boolean coordinatesValid = checkCoordinate(errors, "pickupLatitude", draft.getPickupLatitude(), 90)
                & checkCoordinate(errors, "pickupLongitude", draft.getPickupLongitude(), 180)
                & checkCoordinate(errors, "dropoffLatitude", draft.getDropoffLatitude(), 90)
                & checkCoordinate(errors, "dropoffLongitude", draft.getDropoffLongitude(), 180);
        if (coordinatesValid
                && Math.abs(draft.getPickupLatitude() - draft.getDropoffLatitude()) <= SAME_POINT_TOLERANCE_DEG
                && Math.abs(draft.getPickupLongitude() - draft.getDropoffLongitude()) <= SAME_POINT_TOLERANCE_DEG) {
            add(errors, "dropoffLatitude", "Pickup and dropoff locations must be different.");
        }

        if (draft.getPickupTime() == null) {
            add(errors, "pickupTime", REQUIRED);
        } else if (checkPickupTime && draft.getPickupTime().isBefore(clock.instant().minus(PICKUP_TIME_GRACE))) {
            add(errors, "pickupTime", "Pickup time cannot be more than 5 minutes in the past.");
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        User rider = userRepository.findById(draft.getRiderId())
                .orElseThrow(() -> NotFoundException.of("User", draft.getRiderId()));
        User driver = userRepository.findById(draft.getDriverId())
                .orElseThrow(() -> NotFoundException.of("User", draft.getDriverId()));
        checkRole(errors, "rider", rider, User.Role.RIDER);
        checkRole(errors, "driver", driver, User.Role.DRIVER);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new ValidatedRide(draft, rider, driver);
    }

    private static boolean checkCoordinate(Map<String, List<String>> errors, String field, Double value, double bound) {
        if (value == null) {
            add(errors, field, REQUIRED);
            return false;
        }
        if (!Double.isFinite(value)) {
            add(errors, field, field + " must be a finite number.");
            return false;
        }
        if (value < -bound || value > bound) {
            add(errors, field, field + " must be between " + (int) -bound + " and " + (int) bound + " degrees.");
            return false;
        }
        return true;
    }

    private static void checkRole(Map<String, List<String>> errors, String field, User user, User.Role expected) {
        if (user.getRole() != expected) {
            add(errors, field, "user " + user.getId() + " has role '" + user.getRole().value()
                    + "', expected '" + expected.value() + "'");
        }
    }

    private static void add(Map<String, List<String>> errors, String field, String message) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }
}
