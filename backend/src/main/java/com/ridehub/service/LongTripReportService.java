package com.ridehub.service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ridehub.dto.LongTripRow;
import com.ridehub.entity.Ride;
import com.ridehub.entity.User;
import com.ridehub.repository.FirstEventTime;
import com.ridehub.repository.RideEventRepository;
import com.ridehub.repository.RideRepository;

/**
 * Monthly count, per driver, of trips that took more than an hour from the
 * driver arriving at pickup to the ride completing.
 */
@Service
public class LongTripReportService {

    public static final String ARRIVED_AT_PICKUP = "Driver arrived at pickup location";
    public static final String RIDE_COMPLETED = "Ride completed";
    static final Duration LONG_TRIP = Duration.ofHours(1);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private final RideEventRepository rideEventRepository;
    private final RideRepository rideRepository;

    public LongTripReportService(RideEventRepository rideEventRepository, RideRepository rideRepository) {
        this.rideEventRepository = rideEventRepository;
        this.rideRepository = rideRepository;
    }

    @Transactional(readOnly = true)
    public List<LongTripRow> longTrips() {
        Map<Long, Instant> arrivals = new HashMap<>();
        Map<Long, Instant> completions = new HashMap<>();
        for (FirstEventTime first : rideEventRepository.findFirstOccurrences(List.of(ARRIVED_AT_PICKUP, RIDE_COMPLETED))) {
            if (ARRIVED_AT_PICKUP.equals(first.getDescription())) {
                arrivals.put(first.getRideId(), first.getFirstAt());
            } else {
                completions.put(first.getRideId(), first.getFirstAt());
            }
        }
        List<Long> longRideIds = new ArrayList<>();
        arrivals.forEach((rideId, arrivedAt) -> {
            Instant completedAt = completions.get(rideId);
            if (completedAt != null && Duration.between(arrivedAt, completedAt).compareTo(LONG_TRIP) > 0) {
                longRideIds.add(rideId);
            }
        });
        if (longRideIds.isEmpty()) {
            return List.of();
        }

        Map<String, Counter> counters = new HashMap<>();
        for (Ride ride : rideRepository.findAllWithParticipantsByIdIn(longRideIds)) {
            User driver = ride.getDriver();
            String month = MONTH.format(arrivals.get(ride.getId()));
            counters.computeIfAbsent(month + "#" + driver.getId(), k -> new Counter(month, driver)).count++;
        }
        List<Counter> sorted = new ArrayList<>(counters.values());
        sorted.sort(Comparator.comparing((Counter c) -> c.month)
                .thenComparing(c -> c.label)
                .thenComparing(c -> c.driverId));
        List<LongTripRow> rows = new ArrayList<>(sorted.size());
        for (Counter c : sorted) {
            rows.add(new LongTripRow(c.month, c.label, c.count));
        }
        return rows;
    }

    static String driverLabel(User driver) {
        String last = driver.getLastName();
        return last == null || last.isEmpty() ? driver.getFirstName() : driver.getFirstName() + " " + last.charAt(0);
    }

    private static final class Counter {
        private final String month;
        private final String label;
        private final Long driverId;
        private long count;

        Counter(String month, User driver) {
            this.month = month;
            this.label = driverLabel(driver);
            this.driverId = driver.getId();
        }
    }
}
