package com.coursecatalog.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "catalog.storage")
@Data
public class StorageProperties {

    private String courseFile = "course_catalog.json";
}
