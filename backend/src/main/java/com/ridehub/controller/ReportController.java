package com.ridehub.controller;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ridehub.dto.LongTripRow;
import com.ridehub.service.LongTripReportService;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final LongTripReportService longTripReportService;

    public ReportController(LongTripReportService longTripReportService) {
        this.longTripReportService = longTripReportService;
    }

    @GetMapping("/long-trips")
    public List<LongTripRow> longTrips() {
        return longTripReportService.longTrips();
    }
}
