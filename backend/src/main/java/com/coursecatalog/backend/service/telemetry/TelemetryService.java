package com.coursecatalog.backend.service.telemetry;

import com.coursecatalog.backend.config.TelemetryProperties;
import com.coursecatalog.backend.dto.TelemetrySnapshot;
import com.coursecatalog.backend.exception.TelemetryPersistenceException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Ties the in-process {@link TelemetryStore} to the snapshot file, the tracing spans and the
 * Micrometer counters.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TelemetryService {

    static final String REQUEST_OBSERVATION = "catalog.http.request";
    private static final String UNKNOWN = "unknown";

    private final TelemetryStore store;
    private final TelemetrySnapshotWriter writer;
    private final ObservationRegistry observationRegistry;
    private final MeterRegistry meterRegistry;
    private final TelemetryProperties properties;

    // held across snapshot and write: the file never goes back to an older snapshot
    private final ReentrantLock flushLock = new ReentrantLock();

    private Counter domainErrorsCounter;

    @PostConstruct
    void init() {
        domainErrorsCounter = Counter.builder("catalog_domain_errors_total").register(meterRegistry);
        if (properties.isRestoreOnStartup()) {
            try {
                writer.load().ifPresent(persisted -> {
                    store.restore(persisted);
                    log.info("Restored telemetry from {} ({} routes, {} error messages)", writer.getTarget(),
                            persisted.routeRequests().size(), persisted.errors().size());
                });
            } catch (RuntimeException ex) {
                log.error("Could not restore telemetry from {}, starting from an empty aggregate", writer.getTarget(), ex);
            }
        }
    }

    @PreDestroy
    void shutdown() {
        if (properties.isFlushOnShutdown()) {
            flushQuietly();
        }
    }

    /**
     * Counts a request against {@code route} and opens its span. The returned scope must be closed
     * exactly once when the request is over, whatever its outcome.
     */
    public RequestTelemetryScope beginRequest(String route, String method, String clientAddress) {
        Observation observation = Observation.createNotStarted(REQUEST_OBSERVATION, observationRegistry)
                .contextualName(route)
                .lowCardinalityKeyValue("http.route", route)
                .lowCardinalityKeyValue("http.method", method == null ? UNKNOWN : method)
                .highCardinalityKeyValue("client.address", clientAddress == null ? UNKNOWN : clientAddress)
                .start();
        StartToken token = store.recordRequestStart(route);
        Counter.builder("catalog_requests_total")
                .tag("route", route)
                .register(meterRegistry)
                .increment();
        return new RequestTelemetryScope(this, token, observation);
    }

    void completeRequest(StartToken token) {
        store.recordRequestEnd(token.route(), token);
        flushQuietly();
    }

    /**
     * Counts {@code message} and flushes. Persistence failures propagate.
     */
    public void recordError(String message) {
        store.recordError(message);
        if (domainErrorsCounter != null) {
            domainErrorsCounter.increment();
        }
        flush();
    }

    public TelemetrySnapshot snapshot() {
        return store.snapshot();
    }

    public void flush() {
        flushLock.lock();
        try {
            writer.flush(store.snapshot());
        } finally {
            flushLock.unlock();
        }
    }

    private void flushQuietly() {
        try {
            flush();
        } catch (TelemetryPersistenceException ex) {
            log.error("Telemetry flush failed: {}", ex.getMessage(), ex);
        }
    }
}
