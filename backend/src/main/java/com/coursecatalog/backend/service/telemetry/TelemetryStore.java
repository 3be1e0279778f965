package com.coursecatalog.backend.service.telemetry;

import com.coursecatalog.backend.dto.TelemetrySnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Process-wide aggregate of request counts, cumulative processing time per route and error
 * message frequencies.
 * <p>
 * Every mutation and every snapshot runs under a single lock, so increments are never lost and a
 * snapshot is always a consistent point-in-time view. Count and time for a route live in one
 * {@link RouteStats} entry, which keeps the two published mappings on the same key set.
 * Nothing here performs I/O.
 */
@Component
public class TelemetryStore {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RouteStats> routes = new LinkedHashMap<>();
    private final Map<String, Long> errors = new LinkedHashMap<>();
    private final LongSupplier nanoClock;

    @Autowired
    public TelemetryStore() {
        this(System::nanoTime);
    }

    public TelemetryStore(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public StartToken recordRequestStart(String route) {
        lock.lock();
        try {
            routes.computeIfAbsent(route, key -> new RouteStats()).count++;
            return new StartToken(route, nanoClock.getAsLong());
        } finally {
            lock.unlock();
        }
    }

    public void recordRequestEnd(String route, StartToken token) {
        long elapsed = Math.max(0L, nanoClock.getAsLong() - token.startNanos());
        lock.lock();
        try {
            routes.computeIfAbsent(route, key -> new RouteStats()).totalNanos += elapsed;
        } finally {
            lock.unlock();
        }
    }

    public void recordError(String message) {
        lock.lock();
        try {
            errors.merge(message, 1L, Long::sum);
        } finally {
            lock.unlock();
        }
    }

    public TelemetrySnapshot snapshot() {
        lock.lock();
        try {
            Map<String, Long> requests = new LinkedHashMap<>();
            Map<String, Double> processingTime = new LinkedHashMap<>();
            routes.forEach((route, stats) -> {
                requests.put(route, stats.count);
                processingTime.put(route, stats.totalNanos / NANOS_PER_SECOND);
            });
            return new TelemetrySnapshot(requests, processingTime, new LinkedHashMap<>(errors));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a previously persisted snapshot on top of the current aggregate. A route present in only
     * one of the two persisted mappings gets zero for the other. Entries with a null value are skipped.
     */
    public void restore(TelemetrySnapshot persisted) {
        lock.lock();
        try {
            persisted.routeRequests().forEach((route, count) -> {
                if (route != null && count != null) {
                    routes.computeIfAbsent(route, key -> new RouteStats()).count += Math.max(0L, count);
                }
            });
            persisted.routeProcessingTime().forEach((route, seconds) -> {
                if (route != null && seconds != null) {
                    routes.computeIfAbsent(route, key -> new RouteStats()).totalNanos
                            += Math.max(0L, Math.round(seconds * NANOS_PER_SECOND));
                }
            });
            persisted.errors().forEach((message, count) -> {
                if (message != null && count != null) {
                    errors.merge(message, Math.max(0L, count), Long::sum);
                }
            });
        } finally {
            lock.unlock();
        }
    }

    // guarded by lock
    private static final class RouteStats {
        private long count;
        private long totalNanos;
    }
}
