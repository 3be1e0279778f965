package com.coursecatalog.backend.controller;

import com.coursecatalog.backend.dto.TelemetryReport;
import com.coursecatalog.backend.service.telemetry.TelemetryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
public class TelemetryController {

    private final TelemetryService telemetryService;

    @GetMapping
    public TelemetryReport telemetry() {
        return TelemetryReport.of(telemetryService.snapshot());
    }
}
