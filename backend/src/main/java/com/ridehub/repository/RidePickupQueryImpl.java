package com.ridehub.repository;

import java.util.List;

import org.springframework.data.jpa.domain.Specification;

import com.ridehub.entity.Ride;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

public class RidePickupQueryImpl implements RidePickupQuery {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<RidePickup> findPickups(Specification<Ride> spec) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<RidePickup> query = cb.createQuery(RidePickup.class);
        Root<Ride> root = query.from(Ride.class);
        query.select(cb.construct(RidePickup.class,
                root.get("id"), root.get("pickupLatitude"), root.get("pickupLongitude")));
        if (spec != null) {
            Predicate predicate = spec.toPredicate(root, query, cb);
            if (predicate != null) {
                query.where(predicate);
            }
        }
        return entityManager.createQuery(query).getResultList();
    }
}
