package com.coursecatalog.backend.service.telemetry;

/**
 * Handed out by {@link TelemetryStore#recordRequestStart(String)} and passed back on completion.
 *
 * @param route      route id the request was counted under
 * @param startNanos monotonic clock reading taken when the request was counted
 */
public record StartToken(String route, long startNanos) {
}
