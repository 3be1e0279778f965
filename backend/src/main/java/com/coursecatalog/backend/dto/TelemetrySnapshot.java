package com.coursecatalog.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time copy of the request telemetry aggregate. This is also the shape of the
 * persisted telemetry document.
 *
 * @param routeRequests       route id to number of requests started
 * @param routeProcessingTime route id to cumulative elapsed seconds (a sum, not a mean)
 * @param errors              literal error message to occurrence count
 */
public record TelemetrySnapshot(
        @JsonProperty("route_requests") Map<String, Long> routeRequests,
        @JsonProperty("route_processing_time") Map<String, Double> routeProcessingTime,
        @JsonProperty("errors") Map<String, Long> errors
) {

    public TelemetrySnapshot {
        routeRequests = freeze(routeRequests);
        routeProcessingTime = freeze(routeProcessingTime);
        errors = freeze(errors);
    }

    public static TelemetrySnapshot empty() {
        return new TelemetrySnapshot(Map.of(), Map.of(), Map.of());
    }

    /**
     * Mean latency per route in seconds, derived from the cumulative time and the request count.
     */
    public Map<String, Double> meanProcessingTime() {
        Map<String, Double> means = new LinkedHashMap<>();
        routeRequests.forEach((route, count) -> {
            double total = routeProcessingTime.getOrDefault(route, 0.0);
            means.put(route, count == 0 ? 0.0 : total / count);
        });
        return Collections.unmodifiableMap(means);
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
