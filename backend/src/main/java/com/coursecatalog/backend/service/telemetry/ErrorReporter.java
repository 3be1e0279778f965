package com.coursecatalog.backend.service.telemetry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry point for handlers to count a recognised domain failure. Never throws, so the failure
 * being reported keeps propagating through the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorReporter {

    private final TelemetryService telemetryService;

    public void report(String message) {
        try {
            telemetryService.recordError(message);
        } catch (RuntimeException ex) {
            log.error("Failed to record telemetry for error '{}'", message, ex);
        }
    }
}
