package com.ridehub.service;

import java.util.Locale;

import org.springframework.data.jpa.domain.Specification;

import com.ridehub.entity.Ride;

import jakarta.persistence.criteria.JoinType;

final class RideSpecifications {

    private RideSpecifications() {
    }

    static Specification<Ride> matching(RideQuery query) {
        Specification<Ride> spec = Specification.where(null);
        if (query.getStatus() != null) {
            spec = spec.and(hasStatus(query.getStatus()));
        }
        if (query.getRiderEmail() != null) {
            spec = spec.and(riderEmail(query.getRiderEmail()));
        }
        if (query.getRiderId() != null) {
            spec = spec.and(riderId(query.getRiderId()));
        }
        if (query.getDriverId() != null) {
            spec = spec.and(driverId(query.getDriverId()));
        }
        return spec;
    }

    static Specification<Ride> hasStatus(String status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    static Specification<Ride> riderEmail(String email) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return (root, query, cb) -> cb.equal(cb.lower(root.get("rider").get("email")), normalized);
    }

    static Specification<Ride> riderId(Long riderId) {
        return (root, query, cb) -> cb.equal(root.get("rider").get("id"), riderId);
    }

    static Specification<Ride> driverId(Long driverId) {
        return (root, query, cb) -> cb.equal(root.get("driver").get("id"), driverId);
    }

    /** Fetches rider and driver with the page itself; skipped for count queries. */
    static Specification<Ride> fetchParticipants() {
        return (root, query, cb) -> {
            if (Ride.class.equals(query.getResultType())) {
                root.fetch("rider", JoinType.INNER);
                root.fetch("driver", JoinType.INNER);
            }
            return null;
        };
    }
}
