package com.coursecatalog.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final TelemetryInterceptor telemetryInterceptor;
    private final TelemetryProperties telemetryProperties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!telemetryProperties.isEnabled()) {
            log.info("Request telemetry disabled");
            return;
        }
        registry.addInterceptor(telemetryInterceptor)
                .addPathPatterns("/**")
                .excludePathPatterns("/error");
    }
}
