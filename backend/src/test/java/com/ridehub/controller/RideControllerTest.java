package com.ridehub.controller;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import com.ridehub.IntegrationTestSupport;
import com.ridehub.entity.Ride;
import com.ridehub.entity.User;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
@WithMockUser(username = "ops", authorities = "ADMIN")
class RideControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    private User rider;
    private User driver;
    private Instant later;

    @BeforeEach
    void setUp() {
        rider = saveUser("rick", User.Role.RIDER);
        driver = saveUser("dora", User.Role.DRIVER);
        later = Instant.now().plus(Duration.ofDays(1));
    }

    @Test
    void createsRide() throws Exception {
        mockMvc.perform(post("/api/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(rideJson(rider.getId(), driver.getId(), 37.7749)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.status").value("requested"))
                .andExpect(jsonPath("$.riderDetails.role").value("rider"))
                .andExpect(jsonPath("$.driverDetails.username").value("dora"))
                .andExpect(jsonPath("$.rideEvents", hasSize(0)));
    }

    @Test
    void acceptsSnakeCaseFieldNames() throws Exception {
        String body = """
                {"status": "requested", "rider_id": %d, "driver_id": %d,
                 "pickup_latitude": 37.7749, "pickup_longitude": -122.4194,
                 "dropoff_latitude": 37.8044, "dropoff_longitude": -122.2712,
                 "pickup_time": "%s"}
                """.formatted(rider.getId(), driver.getId(), later);

        mockMvc.perform(post("/api/rides").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.riderId").value(rider.getId()));
    }

    @Test
    void rejectsOutOfRangeLatitudeWithFieldErrors() throws Exception {
        mockMvc.perform(post("/api/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(rideJson(rider.getId(), driver.getId(), 100)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fields.pickupLatitude[0]").value(containsString("between -90 and 90")));
    }

    @Test
    void unknownParticipantIsNotFound() throws Exception {
        mockMvc.perform(post("/api/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(rideJson(rider.getId(), driver.getId() + 100, 37.7749)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/rides").contentType(MediaType.APPLICATION_JSON).content("{\"status\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
        mockMvc.perform(get("/api/rides/not-a-number"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listsByDistance() throws Exception {
        saveRide(rider, driver, "requested", 37.9, -122.0, later);
        saveRide(rider, driver, "requested", 37.7749, -122.4194, later);
        saveRide(rider, driver, "requested", 37.8, -122.45, later);

        mockMvc.perform(get("/api/rides")
                        .param("latitude", "37.7749")
                        .param("longitude", "-122.4194")
                        .param("ordering", "distance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.currentPage").value(1))
                .andExpect(jsonPath("$.next").value(nullValue()))
                .andExpect(jsonPath("$.results[0].distanceToPickup").value(closeTo(0.0, 1e-9)))
                .andExpect(jsonPath("$.results[1].distanceToPickup").value(closeTo(3.876, 0.01)))
                .andExpect(jsonPath("$.results[2].distanceToPickup").value(closeTo(39.37, 0.01)));
    }

    @Test
    void paginationEnvelopeLinksNeighbourPages() throws Exception {
        for (int i = 0; i < 12; i++) {
            saveRide(rider, driver, "requested", 37.8, -122.45, later);
        }

        mockMvc.perform(get("/api/rides").param("page", "2").param("page_size", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(12))
                .andExpect(jsonPath("$.pageSize").value(5))
                .andExpect(jsonPath("$.totalPages").value(3))
                .andExpect(jsonPath("$.currentPage").value(2))
                .andExpect(jsonPath("$.next").value(containsString("page=3")))
                .andExpect(jsonPath("$.previous").value(containsString("page=1")))
                .andExpect(jsonPath("$.results", hasSize(5)));

        mockMvc.perform(get("/api/rides").param("page_size", "500"))
                .andExpect(jsonPath("$.pageSize").value(100));

        mockMvc.perform(get("/api/rides").param("page", "9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results", hasSize(0)));
    }

    @Test
    void hugePageNumberIsAnEmptyPage() throws Exception {
        saveRide(rider, driver, "requested", 37.8, -122.45, later);

        mockMvc.perform(get("/api/rides").param("page", "21474837").param("page_size", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results", hasSize(0)));
        mockMvc.perform(get("/api/rides").param("page", "300000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results", hasSize(0)));
    }

    @Test
    void filteredShortcutsRequireTheirParameter() throws Exception {
        saveRide(rider, driver, "pickup", 37.8, -122.45, later);

        mockMvc.perform(get("/api/rides/by-status"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.status").exists());
        mockMvc.perform(get("/api/rides/by-status").param("status", "pickup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));
        mockMvc.perform(get("/api/rides/rider-rides"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/rides/driver-rides").param("driverId", String.valueOf(driver.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].driverId").value(driver.getId()));
    }

    @Test
    void filtersByRiderEmailAlias() throws Exception {
        saveRide(rider, driver, "pickup", 37.8, -122.45, later);

        mockMvc.perform(get("/api/rides").param("rider_email", "RICK@example.com"))
                .andExpect(jsonPath("$.count").value(1));
        mockMvc.perform(get("/api/rides").param("riderEmail", "nobody@example.com"))
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void patchesStatusAndDeletes() throws Exception {
        Ride ride = saveRide(rider, driver, "en-route", 37.8, -122.45, Instant.now().minus(Duration.ofHours(2)));

        mockMvc.perform(patch("/api/rides/{id}", ride.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"dropoff\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("dropoff"));

        mockMvc.perform(delete("/api/rides/{id}", ride.getId()))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/rides/{id}", ride.getId()))
                .andExpect(status().isNotFound());
    }

    @Test
    void appendsEvents() throws Exception {
        Ride ride = saveRide(rider, driver, "en-route", 37.8, -122.45, later);

        mockMvc.perform(post("/api/rides/{id}/events", ride.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Driver arrived at pickup location\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.rideId").value(ride.getId()))
                .andExpect(jsonPath("$.createdAt").isString());

        mockMvc.perform(post("/api/rides/{id}/events", ride.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"  \"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/rides/{id}", ride.getId()))
                .andExpect(jsonPath("$.rideEvents", hasSize(1)));
    }

    private String rideJson(Long riderId, Long driverId, double pickupLatitude) {
        return """
                {"status": "requested", "riderId": %d, "driverId": %d,
                 "pickupLatitude": %s, "pickupLongitude": -122.4194,
                 "dropoffLatitude": 37.8044, "dropoffLongitude": -122.2712,
                 "pickupTime": "%s"}
                """.formatted(riderId, driverId, pickupLatitude, later);
    }
}
