package com.coursecatalog.backend.service.telemetry;

import io.micrometer.observation.Observation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One request's telemetry bracket: the counted start, the tracing span and the pending end.
 * Closing it records the elapsed time, flushes and stops the span. Closing twice is a no-op, so
 * callers can close it from any exit path without double counting.
 */
public final class RequestTelemetryScope implements AutoCloseable {

    private final TelemetryService telemetryService;
    private final StartToken token;
    private final Observation observation;
    private final AtomicBoolean closed = new AtomicBoolean();

    RequestTelemetryScope(TelemetryService telemetryService, StartToken token, Observation observation) {
        this.telemetryService = telemetryService;
        this.token = token;
        this.observation = observation;
    }

    public String route() {
        return token.route();
    }

    public StartToken token() {
        return token;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void recordCorrelation(String requestId, String correlationId) {
        if (requestId != null) {
            observation.highCardinalityKeyValue("request.id", requestId);
        }
        if (correlationId != null) {
            observation.highCardinalityKeyValue("correlation.id", correlationId);
        }
    }

    public void recordStatus(int status) {
        observation.lowCardinalityKeyValue("http.status_code", String.valueOf(status));
    }

    public void recordFailure(Throwable error) {
        observation.error(error);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            telemetryService.completeRequest(token);
        } finally {
            observation.stop();
        }
    }
}
