package com.coursecatalog.backend.config;

import com.coursecatalog.backend.service.telemetry.RequestTelemetryScope;
import com.coursecatalog.backend.service.telemetry.TelemetryService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Brackets every dispatched request with a {@link RequestTelemetryScope}.
 * <p>
 * Requests are aggregated under the symbolic name of the handler method ({@code courseDetails}),
 * not the concrete URL, so every course code lands on the same key. The span carries the ids
 * assigned by {@link RequestCorrelationFilter}, and the route id is put in the MDC for the rest of
 * the request. Spring calls {@link #afterCompletion} for every request whose {@link #preHandle}
 * returned {@code true}, also when the handler throws, which keeps starts and ends paired.
 */
@Component
@RequiredArgsConstructor
public class TelemetryInterceptor implements HandlerInterceptor {

    public static final String ROUTE_ATTRIBUTE = TelemetryInterceptor.class.getName() + ".route";
    static final String SCOPE_ATTRIBUTE = TelemetryInterceptor.class.getName() + ".scope";
    static final String UNMATCHED_ROUTE = "unmatched";

    private final TelemetryService telemetryService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (request.getAttribute(SCOPE_ATTRIBUTE) != null) {
            return true;
        }
        String route = resolveRoute(request, handler);
        RequestTelemetryScope scope = telemetryService.beginRequest(route, request.getMethod(), request.getRemoteAddr());
        scope.recordCorrelation(MDC.get(RequestCorrelationFilter.REQUEST_ID_KEY),
                MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY));
        MDC.put(RequestCorrelationFilter.ROUTE_KEY, route);
        request.setAttribute(ROUTE_ATTRIBUTE, route);
        request.setAttribute(SCOPE_ATTRIBUTE, scope);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        if (!(request.getAttribute(SCOPE_ATTRIBUTE) instanceof RequestTelemetryScope scope)) {
            return;
        }
        request.removeAttribute(SCOPE_ATTRIBUTE);
        try {
            scope.recordStatus(response.getStatus());
            if (ex != null) {
                scope.recordFailure(ex);
            }
        } finally {
            scope.close();
        }
    }

    String resolveRoute(HttpServletRequest request, Object handler) {
        if (handler instanceof HandlerMethod handlerMethod) {
            return handlerMethod.getMethod().getName();
        }
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern != null) {
            return pattern.toString();
        }
        return UNMATCHED_ROUTE;
    }
}
