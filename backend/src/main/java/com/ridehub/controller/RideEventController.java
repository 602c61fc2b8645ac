package com.ridehub.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.ridehub.dto.PageResponse;
import com.ridehub.dto.RideEventRequest;
import com.ridehub.dto.RideEventResponse;
import com.ridehub.exception.ValidationException;
import com.ridehub.service.RideEventService;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/ride-events")
@RequiredArgsConstructor
public class RideEventController {

    private final RideEventService rideEventService;
    private final Paginator paginator;

    @GetMapping
    public PageResponse<RideEventResponse> listEvents(@RequestParam(required = false) Long rideId,
                                                      @RequestParam(required = false) String search,
                                                      @RequestParam(required = false) String ordering,
                                                      @RequestParam(required = false) Integer page,
                                                      @RequestParam(name = "page_size", required = false) Integer pageSize,
                                                      HttpServletRequest request) {
        return paginator.envelope(
                rideEventService.listEvents(rideId, search, ordering, paginator.pageable(page, pageSize)), request);
    }

    @GetMapping("/{id}")
    public RideEventResponse getEvent(@PathVariable Long id) {
        return rideEventService.getEvent(id);
    }

    @PostMapping
    public ResponseEntity<RideEventResponse> createEvent(@RequestBody RideEventRequest request) {
        if (request.getRideId() == null) {
            throw new ValidationException("rideId", "This field is required.");
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(rideEventService.appendEvent(request.getRideId(), request.getDescription()));
    }

    @PatchMapping("/{id}")
    public RideEventResponse updateEvent(@PathVariable Long id, @RequestBody RideEventRequest request) {
        return rideEventService.updateEvent(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEvent(@PathVariable Long id) {
        rideEventService.deleteEvent(id);
        return ResponseEntity.noContent().build();
    }
}
