package com.ridehub.entity;

import java.time.Instant;

import jakarta.persistence.*;

@Entity
@Table(name = "ride_events", indexes = {
    @Index(name = "idx_ride_events_ride_created", columnList = "ride_id, created_at"),
    @Index(name = "idx_ride_events_created", columnList = "created_at")
})
public class RideEvent {

    public static final int DESCRIPTION_MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ride_id", nullable = false)
    private Ride ride;

    @Column(nullable = false, length = DESCRIPTION_MAX_LENGTH)
    private String description;

    // Assigned by the service from the application clock, never from a request body
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public RideEvent() {
    }

    public RideEvent(Ride ride, String description, Instant createdAt) {
        this.ride = ride;
        this.description = description;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Ride getRide() { return ride; }
    public void setRide(Ride ride) { this.ride = ride; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
