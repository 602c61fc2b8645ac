package com.ridehub.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.ridehub.dto.PageResponse;
import com.ridehub.dto.RideDetailView;
import com.ridehub.dto.RideEventRequest;
import com.ridehub.dto.RideEventResponse;
import com.ridehub.dto.RideListView;
import com.ridehub.dto.RideRequest;
import com.ridehub.exception.ValidationException;
import com.ridehub.service.RideEventService;
import com.ridehub.service.RideQuery;
import com.ridehub.service.RideQueryComposer;
import com.ridehub.service.RideService;

import jakarta.servlet.http.HttpServletRequest;

@RestController
@RequestMapping("/api/rides")
public class RideController {
    private static final Logger logger = LoggerFactory.getLogger(RideController.class);

    private final RideService rideService;
    private final RideEventService rideEventService;
    private final RideQueryComposer rideQueryComposer;
    private final Paginator paginator;

    public RideController(RideService rideService, RideEventService rideEventService,
                          RideQueryComposer rideQueryComposer, Paginator paginator) {
        this.rideService = rideService;
        this.rideEventService = rideEventService;
        this.rideQueryComposer = rideQueryComposer;
        this.paginator = paginator;
    }

    @GetMapping
    public PageResponse<RideListView> listRides(@RequestParam(required = false) String status,
                                                @RequestParam(required = false) String riderEmail,
                                                @RequestParam(name = "rider_email", required = false) String riderEmailAlias,
                                                @RequestParam(required = false) Long riderId,
                                                @RequestParam(required = false) Long driverId,
                                                @RequestParam(required = false) String latitude,
                                                @RequestParam(required = false) String longitude,
                                                @RequestParam(required = false) String ordering,
                                                @RequestParam(required = false) Integer page,
                                                @RequestParam(name = "page_size", required = false) Integer pageSize,
                                                HttpServletRequest request) {
        RideQuery query = RideQuery.builder()
                .status(status)
                .riderEmail(riderEmail != null ? riderEmail : riderEmailAlias)
                .riderId(riderId)
                .driverId(driverId)
                .latitude(latitude)
                .longitude(longitude)
                .ordering(ordering)
                .build();
        return list(query, page, pageSize, request);
    }

    @GetMapping("/by-status")
    public PageResponse<RideListView> ridesByStatus(@RequestParam(required = false) String status,
                                                    @RequestParam(required = false) Integer page,
                                                    @RequestParam(name = "page_size", required = false) Integer pageSize,
                                                    HttpServletRequest request) {
        if (status == null || status.isBlank()) {
            throw new ValidationException("status", "Status parameter is required.");
        }
        return list(RideQuery.builder().status(status).build(), page, pageSize, request);
    }

    @GetMapping("/rider-rides")
    public PageResponse<RideListView> riderRides(@RequestParam(required = false) Long riderId,
                                                 @RequestParam(required = false) Integer page,
                                                 @RequestParam(name = "page_size", required = false) Integer pageSize,
                                                 HttpServletRequest request) {
        if (riderId == null) {
            throw new ValidationException("riderId", "riderId parameter is required.");
        }
        return list(RideQuery.builder().riderId(riderId).build(), page, pageSize, request);
    }

    @GetMapping("/driver-rides")
    public PageResponse<RideListView> driverRides(@RequestParam(required = false) Long driverId,
                                                  @RequestParam(required = false) Integer page,
                                                  @RequestParam(name = "page_size", required = false) Integer pageSize,
                                                  HttpServletRequest request) {
        if (driverId == null) {
            throw new ValidationException("driverId", "driverId parameter is required.");
        }
        return list(RideQuery.builder().driverId(driverId).build(), page, pageSize, request);
    }

    @GetMapping("/{id}")
    public RideDetailView getRide(@PathVariable Long id) {
        return rideService.getRide(id);
    }

    @PostMapping
    public ResponseEntity<RideDetailView> createRide(@RequestBody RideRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rideService.createRide(request));
    }

    @PutMapping("/{id}")
    public RideDetailView replaceRide(@PathVariable Long id, @RequestBody RideRequest request) {
        return rideService.replaceRide(id, request);
    }

    @PatchMapping("/{id}")
    public RideDetailView updateRide(@PathVariable Long id, @RequestBody RideRequest request) {
        return rideService.updateRide(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRide(@PathVariable Long id) {
        rideService.deleteRide(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/events")
    public ResponseEntity<RideEventResponse> addEvent(@PathVariable Long id, @RequestBody RideEventRequest request) {
        logger.debug("Append event requested for ride {}", id);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(rideEventService.appendEvent(id, request.getDescription()));
    }

    private PageResponse<RideListView> list(RideQuery query, Integer page, Integer pageSize,
                                            HttpServletRequest request) {
        return paginator.envelope(rideQueryComposer.list(query, paginator.pageable(page, pageSize)), request);
    }
}
