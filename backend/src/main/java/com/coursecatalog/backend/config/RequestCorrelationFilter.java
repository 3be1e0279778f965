package com.coursecatalog.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Assigns the request and correlation ids every catalog request is traced and logged under.
 * <p>
 * The ids go into the MDC (picked up by the log pattern, {@code ApiError} bodies and the
 * {@code catalog.http.request} span) and are echoed as response headers. The route id that
 * {@link TelemetryInterceptor} adds to the MDC later in the request is cleared here as well.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_KEY = "requestId";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String ROUTE_KEY = "route";

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = getOrCreate(request.getHeader(REQUEST_ID_HEADER));
        String correlationId = getOrCreate(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(CORRELATION_ID_KEY);
            MDC.remove(ROUTE_KEY);
        }
    }

    private String getOrCreate(String value) {
        return (value == null || value.isBlank()) ? UUID.randomUUID().toString() : value.trim();
    }
}
