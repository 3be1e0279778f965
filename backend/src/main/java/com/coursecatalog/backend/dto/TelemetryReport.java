package com.coursecatalog.backend.dto;

import java.util.Map;

public record TelemetryReport(
        TelemetrySnapshot snapshot,
        Map<String, Double> meanProcessingTime
) {

    public static TelemetryReport of(TelemetrySnapshot snapshot) {
        return new TelemetryReport(snapshot, snapshot.meanProcessingTime());
    }
}
