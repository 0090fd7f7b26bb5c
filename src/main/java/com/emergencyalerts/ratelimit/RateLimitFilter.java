package com.emergencyalerts.ratelimit;

import com.emergencyalerts.api.dto.response.ApiErrorResponse;
import com.emergencyalerts.auth.AuthenticatedUser;
import com.emergencyalerts.exception.ErrorCode;
import com.emergencyalerts.observability.AlertMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies {@link ApiRateLimiter} to authenticated API requests. Must run after
 * {@link com.emergencyalerts.auth.JwtAuthFilter}, which supplies the user; requests without a
 * user pass through untouched.
 *
 * <p>Limited endpoints get {@code X-RateLimit-Limit} and {@code X-RateLimit-Remaining} headers.
 * Over the limit the chain stops with 429, a {@code Retry-After} header and a RATE_LIMITED
 * error body.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final ApiRateLimiter apiRateLimiter;
    private final AlertMetricsService alertMetricsService;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(
            ApiRateLimiter apiRateLimiter, AlertMetricsService alertMetricsService, ObjectMapper objectMapper) {
        this.apiRateLimiter = apiRateLimiter;
        this.alertMetricsService = alertMetricsService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Object attribute = request.getAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE);
        if (!(attribute instanceof AuthenticatedUser)) {
            filterChain.doFilter(request, response);
            return;
        }
        AuthenticatedUser user = (AuthenticatedUser) attribute;

        RateLimitDecision decision =
                apiRateLimiter.tryAcquire(user.getUserId(), request.getMethod(), request.getRequestURI());
        if (!decision.isLimited()) {
            filterChain.doFilter(request, response);
            return;
        }

        response.setHeader(LIMIT_HEADER, String.valueOf(decision.getLimit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.getRemaining()));
        if (decision.isAllowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn(
                "Rate limit exceeded for user {} on {} (limit {})",
                user.getUserId(),
                decision.getEndpointKey(),
                decision.getLimit());
        alertMetricsService.recordRateLimited(decision.getLimitGroup());
        writeTooManyRequests(request, response, decision);
    }

    private void writeTooManyRequests(
            HttpServletRequest request, HttpServletResponse response, RateLimitDecision decision) throws IOException {
        ApiErrorResponse errorResponse = ApiErrorResponse.of(
                ErrorCode.RATE_LIMITED,
                String.format(
                        "Rate limit of %d requests exceeded for %s, retry after %d seconds",
                        decision.getLimit(),
                        decision.getEndpointKey(),
                        decision.getRetryAfterSeconds()),
                Map.of("limit", decision.getLimit(), "retryAfterSeconds", decision.getRetryAfterSeconds()),
                request.getRequestURI());
        response.setStatus(ErrorCode.RATE_LIMITED.getHttpStatus());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), errorResponse);
    }
}
