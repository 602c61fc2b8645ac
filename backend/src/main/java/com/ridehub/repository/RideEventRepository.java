package com.ridehub.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.ridehub.entity.RideEvent;

@Repository
public interface RideEventRepository extends JpaRepository<RideEvent, Long>, JpaSpecificationExecutor<RideEvent> {

    long countByRideId(Long rideId);

    List<RideEvent> findByRideIdOrderByCreatedAtDescIdDesc(Long rideId);

    @Query("SELECT e FROM RideEvent e WHERE e.ride.id IN :rideIds AND e.createdAt >= :cutoff "
            + "ORDER BY e.createdAt DESC, e.id DESC")
    List<RideEvent> findRecentByRideIds(@Param("rideIds") Collection<Long> rideIds,
                                        @Param("cutoff") Instant cutoff);

    @Query("SELECT e.ride.id AS rideId, e.description AS description, MIN(e.createdAt) AS firstAt "
            + "FROM RideEvent e WHERE e.description IN :descriptions GROUP BY e.ride.id, e.description")
    List<FirstEventTime> findFirstOccurrences(@Param("descriptions") Collection<String> descriptions);

    @Modifying
    @Query("DELETE FROM RideEvent e WHERE e.ride.id IN :rideIds")
    int deleteByRideIdIn(@Param("rideIds") Collection<Long> rideIds);
}
