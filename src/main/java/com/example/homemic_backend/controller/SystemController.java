package com.example.homemic_backend.controller;

import com.example.homemic_backend.dto.AnalyticsResponse;
import com.example.homemic_backend.dto.SystemStatusResponse;
import com.example.homemic_backend.service.AnalyticsService;
import com.example.homemic_backend.service.SystemStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class SystemController {
    private final SystemStatusService statusService;
    private final AnalyticsService analyticsService;

    public SystemController(SystemStatusService statusService, AnalyticsService analyticsService) {
        this.statusService = statusService;
        this.analyticsService = analyticsService;
    }

    @GetMapping("/status")
    public SystemStatusResponse status() {
        return statusService.status();
    }

    @GetMapping("/analytics/room")
    public AnalyticsResponse.Rooms rooms(@RequestParam(value = "period_hours", defaultValue = "24") int periodHours) {
        return analyticsService.rooms(periodHours);
    }

    @GetMapping("/analytics/speakers")
    public AnalyticsResponse.Speakers speakers(@RequestParam(value = "period_hours", defaultValue = "24") int periodHours) {
        return analyticsService.speakers(periodHours);
    }

    @GetMapping("/analytics/hourly")
    public AnalyticsResponse.Hourly hourly(@RequestParam(value = "period_hours", defaultValue = "24") int periodHours) {
        return analyticsService.hourly(periodHours);
    }
}
