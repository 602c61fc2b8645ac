package com.ridehub.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.ridehub.entity.Ride;

import jakarta.persistence.LockModeType;

@Repository
public interface RideRepository extends JpaRepository<Ride, Long>, JpaSpecificationExecutor<Ride>, RidePickupQuery {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Ride r WHERE r.id = :id")
    Optional<Ride> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT r FROM Ride r JOIN FETCH r.rider JOIN FETCH r.driver WHERE r.id = :id")
    Optional<Ride> findWithParticipantsById(@Param("id") Long id);

    @Query("SELECT r FROM Ride r JOIN FETCH r.rider JOIN FETCH r.driver WHERE r.id IN :ids")
    List<Ride> findAllWithParticipantsByIdIn(@Param("ids") Collection<Long> ids);

    @Query("SELECT r.id FROM Ride r WHERE r.rider.id = :userId OR r.driver.id = :userId")
    List<Long> findIdsByParticipant(@Param("userId") Long userId);

    @Modifying
    @Query("DELETE FROM Ride r WHERE r.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<Long> ids);
}
