package com.coursecatalog.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "catalog.telemetry")
@Data
public class TelemetryProperties {

    private boolean enabled = true;
    private String file = "telemetry.json";
    /** Load the last persisted snapshot at startup instead of starting from zero. */
    private boolean restoreOnStartup = false;
    private boolean flushOnShutdown = true;
}
