package com.coursecatalog.backend.service.telemetry;

import com.coursecatalog.backend.config.TelemetryProperties;
import com.coursecatalog.backend.dto.TelemetrySnapshot;
import com.coursecatalog.backend.exception.TelemetryPersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelemetryServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong clock = new AtomicLong();
    private TelemetryStore store;
    private TelemetrySnapshotWriter writer;
    private MeterRegistry meterRegistry;
    private TelemetryProperties properties;
    private TelemetryService telemetryService;

    @BeforeEach
    void setUp() {
        store = new TelemetryStore(clock::get);
        writer = new TelemetrySnapshotWriter(objectMapper, tempDir.resolve("telemetry.json"));
        meterRegistry = new SimpleMeterRegistry();
        properties = new TelemetryProperties();
        telemetryService = newService(writer);
    }

    @Test
    void closingScopeRecordsElapsedTimeAndFlushes() {
        try (RequestTelemetryScope scope = telemetryService.beginRequest("courseCatalog", "GET", "127.0.0.1")) {
            clock.addAndGet(50_000_000L);
            assertThat(scope.route()).isEqualTo("courseCatalog");
        }

        TelemetrySnapshot persisted = writer.load().orElseThrow();
        assertThat(persisted.routeRequests()).containsEntry("courseCatalog", 1L);
        assertThat(persisted.routeProcessingTime().get("courseCatalog")).isCloseTo(0.05, within(1e-9));
        assertThat(meterRegistry.get("catalog_requests_total").tag("route", "courseCatalog").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void scopeCompletesWhenHandlerThrows() {
        assertThatThrownBy(() -> {
            try (RequestTelemetryScope ignored = telemetryService.beginRequest("submitCourse", "POST", null)) {
                clock.addAndGet(20_000_000L);
                throw new IllegalStateException("handler failed");
            }
        }).isInstanceOf(IllegalStateException.class).hasMessage("handler failed");

        TelemetrySnapshot snapshot = telemetryService.snapshot();
        assertThat(snapshot.routeRequests()).containsEntry("submitCourse", 1L);
        assertThat(snapshot.routeProcessingTime().get("submitCourse")).isCloseTo(0.02, within(1e-9));
        assertThat(writer.load()).contains(snapshot);
    }

    @Test
    void closingTwiceDoesNotDoubleCountTime() {
        RequestTelemetryScope scope = telemetryService.beginRequest("courseDetails", "GET", "10.0.0.1");
        clock.addAndGet(10_000_000L);
        scope.close();
        clock.addAndGet(90_000_000L);
        scope.close();

        assertThat(scope.isClosed()).isTrue();
        assertThat(telemetryService.snapshot().routeProcessingTime().get("courseDetails")).isCloseTo(0.01, within(1e-9));
    }

    @Test
    void flushFailureAtRequestEndIsContained() {
        TelemetrySnapshotWriter failingWriter = mock(TelemetrySnapshotWriter.class);
        doThrow(new TelemetryPersistenceException("disk full", new java.io.IOException("disk full")))
                .when(failingWriter).flush(any());
        TelemetryService service = newService(failingWriter);

        RequestTelemetryScope scope = service.beginRequest("courseCatalog", "GET", "127.0.0.1");

        assertThatCode(scope::close).doesNotThrowAnyException();
        assertThat(service.snapshot().routeRequests()).containsEntry("courseCatalog", 1L);
        assertThat(service.snapshot().routeProcessingTime()).containsKey("courseCatalog");
    }

    @Test
    void recordErrorCountsAndPropagatesFlushFailure() {
        TelemetrySnapshotWriter failingWriter = mock(TelemetrySnapshotWriter.class);
        doThrow(new TelemetryPersistenceException("denied", new java.io.IOException("denied")))
                .when(failingWriter).flush(any());
        TelemetryService service = newService(failingWriter);

        assertThatThrownBy(() -> service.recordError("boom")).isInstanceOf(TelemetryPersistenceException.class);
        assertThat(service.snapshot().errors()).containsEntry("boom", 1L);
        assertThat(meterRegistry.get("catalog_domain_errors_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void startsEmptyEvenWhenPreviousSnapshotExists() throws Exception {
        writer.flush(new TelemetrySnapshot(Map.of("courseCatalog", 9L), Map.of("courseCatalog", 4.0), Map.of()));

        TelemetryService restarted = newService(writer);

        assertThat(restarted.snapshot().routeRequests()).isEmpty();
        assertThat(Files.exists(writer.getTarget())).isTrue();
    }

    @Test
    void restoresPreviousSnapshotWhenConfigured() {
        writer.flush(new TelemetrySnapshot(Map.of("courseCatalog", 9L), Map.of("courseCatalog", 4.0), Map.of("boom", 2L)));
        properties.setRestoreOnStartup(true);

        TelemetryService restarted = newService(writer);

        assertThat(restarted.snapshot().routeRequests()).containsEntry("courseCatalog", 9L);
        assertThat(restarted.snapshot().errors()).containsEntry("boom", 2L);
    }

    @Test
    void unreadableSnapshotOnRestoreStartsEmpty() {
        TelemetrySnapshotWriter brokenWriter = mock(TelemetrySnapshotWriter.class);
        when(brokenWriter.load()).thenThrow(new TelemetryPersistenceException("corrupt", new java.io.IOException("corrupt")));
        properties.setRestoreOnStartup(true);

        TelemetryService restarted = newService(brokenWriter);

        assertThat(restarted.snapshot()).isEqualTo(TelemetrySnapshot.empty());
    }

    @Test
    void persistedDocumentMatchesMemoryAfterConcurrentErrors() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                String message = "No course found with code 'T" + t + "'.";
                futures.add(executor.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < perThread; i++) {
                        telemetryService.recordError(message);
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        TelemetrySnapshot inMemory = telemetryService.snapshot();
        assertThat(inMemory.errors()).hasSize(threads);
        assertThat(inMemory.errors().values()).allMatch(count -> count == perThread);
        assertThat(writer.load()).contains(inMemory);
    }

    @Test
    void restoreSkipsNullEntriesInHandEditedDocument() throws Exception {
        Files.writeString(writer.getTarget(), """
                {
                  "route_requests" : { "courseCatalog" : 4, "broken" : null },
                  "route_processing_time" : { "courseCatalog" : null },
                  "errors" : { "boom" : null, "bang" : 1 }
                }
                """);
        properties.setRestoreOnStartup(true);

        TelemetryService restarted = newService(writer);

        TelemetrySnapshot snapshot = restarted.snapshot();
        assertThat(snapshot.routeRequests()).containsOnlyKeys("courseCatalog");
        assertThat(snapshot.routeRequests()).containsEntry("courseCatalog", 4L);
        assertThat(snapshot.routeProcessingTime()).containsEntry("courseCatalog", 0.0);
        assertThat(snapshot.errors()).containsOnlyKeys("bang");
    }

    @Test
    void unexpectedFailureDuringRestoreStartsEmpty() {
        TelemetrySnapshotWriter brokenWriter = mock(TelemetrySnapshotWriter.class);
        when(brokenWriter.load()).thenThrow(new IllegalStateException("unexpected document"));
        properties.setRestoreOnStartup(true);

        TelemetryService restarted = newService(brokenWriter);

        assertThat(restarted.snapshot()).isEqualTo(TelemetrySnapshot.empty());
    }

    @Test
    void shutdownFlushesWhenEnabled() {
        TelemetrySnapshotWriter mockWriter = mock(TelemetrySnapshotWriter.class);
        TelemetryService service = newService(mockWriter);

        service.shutdown();
        properties.setFlushOnShutdown(false);
        service.shutdown();

        verify(mockWriter, times(1)).flush(any());
    }

    private TelemetryService newService(TelemetrySnapshotWriter snapshotWriter) {
        store = new TelemetryStore(clock::get);
        TelemetryService service = new TelemetryService(store, snapshotWriter, ObservationRegistry.create(),
                meterRegistry, properties);
        service.init();
        return service;
    }
}
