package com.coursecatalog.backend.service.telemetry;

import com.coursecatalog.backend.config.TelemetryProperties;
import com.coursecatalog.backend.dto.TelemetrySnapshot;
import com.coursecatalog.backend.exception.TelemetryPersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes the telemetry document. Each flush replaces the whole file: the snapshot goes to a
 * sibling temp file first and is then moved over the target.
 */
@Slf4j
@Component
public class TelemetrySnapshotWriter {

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Path target;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Autowired
    public TelemetrySnapshotWriter(ObjectMapper objectMapper, TelemetryProperties properties) {
        this(objectMapper, Path.of(properties.getFile()));
    }

    public TelemetrySnapshotWriter(ObjectMapper objectMapper, Path target) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }

    public void flush(TelemetrySnapshot snapshot) {
        writeLock.lock();
        try {
            Path directory = target.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                writer.writeValue(temp.toFile(), snapshot);
                replace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new TelemetryPersistenceException("Failed to write telemetry snapshot to " + target, e);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<TelemetrySnapshot> load() {
        if (!Files.exists(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(target.toFile(), TelemetrySnapshot.class));
        } catch (IOException e) {
            throw new TelemetryPersistenceException("Failed to read telemetry snapshot from " + target, e);
        }
    }

    private void replace(Path temp) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
