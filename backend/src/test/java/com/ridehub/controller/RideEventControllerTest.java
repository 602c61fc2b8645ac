package com.ridehub.controller;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import com.ridehub.IntegrationTestSupport;
import com.ridehub.entity.Ride;
import com.ridehub.entity.RideEvent;
import com.ridehub.entity.User;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
@WithMockUser(username = "ops", authorities = "ADMIN")
class RideEventControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    private Ride ride;

    @BeforeEach
    void setUp() {
        User rider = saveUser("rhea", User.Role.RIDER);
        User driver = saveUser("dmitri", User.Role.DRIVER);
        ride = saveRide(rider, driver, "pickup", 37.8, -122.45, Instant.now().plus(Duration.ofHours(2)));
    }

    @Test
    void createsAndListsEvents() throws Exception {
        mockMvc.perform(post("/api/ride-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rideId\": " + ride.getId() + ", \"description\": \"Ride requested\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.description").value("Ride requested"));

        mockMvc.perform(get("/api/ride-events").param("rideId", String.valueOf(ride.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results[0].rideId").value(ride.getId()));
    }

    @Test
    void createRequiresRide() throws Exception {
        mockMvc.perform(post("/api/ride-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"orphan\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.rideId").exists());
    }

    @Test
    void fullRideIsConflict() throws Exception {
        List<RideEvent> events = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            events.add(new RideEvent(ride, "seed " + i, Instant.now().minus(Duration.ofDays(3))));
        }
        rideEventRepository.saveAll(events);

        mockMvc.perform(post("/api/ride-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rideId\": " + ride.getId() + ", \"description\": \"overflow\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CAPACITY_EXCEEDED"));
    }

    @Test
    void patchesDescriptionAndDeletes() throws Exception {
        RideEvent event = saveEvent(ride, "Ride requested", Instant.parse("2024-02-01T09:00:00Z"));

        mockMvc.perform(patch("/api/ride-events/{id}", event.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Ride accepted\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description").value("Ride accepted"))
                .andExpect(jsonPath("$.createdAt").value("2024-02-01T09:00:00Z"));

        mockMvc.perform(delete("/api/ride-events/{id}", event.getId()))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/ride-events/{id}", event.getId()))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/ride-events"))
                .andExpect(jsonPath("$.results", hasSize(0)));
    }
}
