package com.ridehub.entity;

import java.time.Instant;

import jakarta.persistence.*;

@Entity
@Table(name = "rides", indexes = {
    @Index(name = "idx_rides_pickup_time", columnList = "pickup_time"),
    @Index(name = "idx_rides_status", columnList = "status"),
    @Index(name = "idx_rides_pickup_coords", columnList = "pickup_latitude, pickup_longitude"),
    @Index(name = "idx_rides_rider_id", columnList = "rider_id"),
    @Index(name = "idx_rides_driver_id", columnList = "driver_id")
})
public class Ride {

    public static final int STATUS_MAX_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Free-form label (requested, en-route, pickup, dropoff, ...), no transition table
    @Column(name = "status", nullable = false, length = STATUS_MAX_LENGTH)
    private String status;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "rider_id", nullable = false)
    private User rider;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "driver_id", nullable = false)
    private User driver;

    @Column(name = "pickup_latitude", nullable = false)
    private double pickupLatitude;

    @Column(name = "pickup_longitude", nullable = false)
    private double pickupLongitude;

    @Column(name = "dropoff_latitude", nullable = false)
    private double dropoffLatitude;

    @Column(name = "dropoff_longitude", nullable = false)
    private double dropoffLongitude;

    @Column(name = "pickup_time", nullable = false)
    private Instant pickupTime;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public User getRider() { return rider; }
    public void setRider(User rider) { this.rider = rider; }
    public User getDriver() { return driver; }
    public void setDriver(User driver) { this.driver = driver; }
    public double getPickupLatitude() { return pickupLatitude; }
    public void setPickupLatitude(double pickupLatitude) { this.pickupLatitude = pickupLatitude; }
    public double getPickupLongitude() { return pickupLongitude; }
    public void setPickupLongitude(double pickupLongitude) { this.pickupLongitude = pickupLongitude; }
    public double getDropoffLatitude() { return dropoffLatitude; }
    public void setDropoffLatitude(double dropoffLatitude) { this.dropoffLatitude = dropoffLatitude; }
    public double getDropoffLongitude() { return dropoffLongitude; }
    public void setDropoffLongitude(double dropoffLongitude) { this.dropoffLongitude = dropoffLongitude; }
    public Instant getPickupTime() { return pickupTime; }
    public void setPickupTime(Instant pickupTime) { this.pickupTime = pickupTime; }
}
