package com.ridehub.repository;

import java.util.List;

import org.springframework.data.jpa.domain.Specification;

import com.ridehub.entity.Ride;

public interface RidePickupQuery {

    /**
     * Returns (id, pickup latitude, pickup longitude) for every ride matching the
     * specification, without loading the rides themselves.
     */
    List<RidePickup> findPickups(Specification<Ride> spec);
}
