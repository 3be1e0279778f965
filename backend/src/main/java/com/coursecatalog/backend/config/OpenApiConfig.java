package com.coursecatalog.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI courseCatalogOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Course Catalog API")
                        .description("Course listing, lookup and submission with per-route request telemetry")
                        .version("1.0"));
    }
}
