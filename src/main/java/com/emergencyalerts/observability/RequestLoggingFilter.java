package com.emergencyalerts.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One log line per API request on completion: method, path, status and duration. Runs inside
 * {@link CorrelationIdFilter} so every line carries the request's correlation id.
 *
 * <p>5xx responses log at ERROR, 4xx at WARN, the rest at INFO. Requests slower than
 * {@code emergency-alerts.logging.slow-request-threshold-ms} get an extra WARN. Health probes
 * are not logged.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private final long slowRequestThresholdMs;

    public RequestLoggingFilter(
            @Value("${emergency-alerts.logging.slow-request-threshold-ms:1000}") long slowRequestThresholdMs) {
        this.slowRequestThresholdMs = slowRequestThresholdMs;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator/health");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        long startNanos = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error(
                    "HTTP {} {} failed after {}ms",
                    request.getMethod(),
                    request.getRequestURI(),
                    elapsedMs(startNanos),
                    e);
            throw e;
        }

        long durationMs = elapsedMs(startNanos);
        int status = response.getStatus();
        if (status >= 500) {
            log.error("HTTP {} {} completed: status={} duration={}ms",
                    request.getMethod(), request.getRequestURI(), status, durationMs);
        } else if (status >= 400) {
            log.warn("HTTP {} {} completed: status={} duration={}ms",
                    request.getMethod(), request.getRequestURI(), status, durationMs);
        } else {
            log.info("HTTP {} {} completed: status={} duration={}ms",
                    request.getMethod(), request.getRequestURI(), status, durationMs);
        }

        if (durationMs > slowRequestThresholdMs) {
            log.warn("Slow request: {} {} took {}ms", request.getMethod(), request.getRequestURI(), durationMs);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
