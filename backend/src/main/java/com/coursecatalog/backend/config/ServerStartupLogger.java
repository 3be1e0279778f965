package com.coursecatalog.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final StorageProperties storageProperties;
    private final TelemetryProperties telemetryProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String address = environment.getProperty("server.address");
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        String baseUrl = String.format("http://%s:%d%s", host, port, contextPath);
        log.info("Server started on port {} (base URL: {})", port, baseUrl);
        log.info("Course catalog file: {}", Path.of(storageProperties.getCourseFile()).toAbsolutePath());
        if (telemetryProperties.isEnabled()) {
            log.info("Telemetry snapshot file: {} (restore on startup: {})",
                    Path.of(telemetryProperties.getFile()).toAbsolutePath(), telemetryProperties.isRestoreOnStartup());
        }
    }
}
