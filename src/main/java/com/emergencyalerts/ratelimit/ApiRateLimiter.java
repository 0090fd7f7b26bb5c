package com.emergencyalerts.ratelimit;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Per-user, per-endpoint request limits for the write endpoints operators and approvers hit:
 * alert creation, and approval or rejection decisions.
 *
 * <p>Each (user, endpoint) pair gets its own Resilience4j {@link RateLimiter} built from the
 * shared config of its limit group, so one user exhausting a limit does not affect others.
 * Permits refresh at the start of each window.
 */
@Service
public class ApiRateLimiter {

    public static final String ALERT_CREATION = "alert-creation";
    public static final String APPROVALS = "approvals";

    private static final Pattern DECISION_PATH = Pattern.compile("/api/alerts/[^/]+/(approval|rejection)");

    private final RateLimiterRegistry rateLimiterRegistry;

    public ApiRateLimiter(RateLimiterRegistry rateLimiterRegistry) {
        this.rateLimiterRegistry = rateLimiterRegistry;
    }

    /** Takes one permit for the user on this endpoint, or reports unlimited for other endpoints. */
    public RateLimitDecision tryAcquire(String userId, String method, String path) {
        Optional<String> group = limitGroup(method, path);
        if (group.isEmpty()) {
            return RateLimitDecision.unlimited();
        }

        String endpointKey = endpointKey(method, path);
        RateLimiter rateLimiter = rateLimiterRegistry.rateLimiter(userId + "|" + endpointKey, group.get());
        RateLimiterConfig config = rateLimiter.getRateLimiterConfig();
        boolean allowed = rateLimiter.acquirePermission();

        return RateLimitDecision.builder()
                .allowed(allowed)
                .endpointKey(endpointKey)
                .limitGroup(group.get())
                .limit(config.getLimitForPeriod())
                .remaining(Math.max(0, rateLimiter.getMetrics().getAvailablePermissions()))
                .retryAfterSeconds(allowed ? 0 : ceilSeconds(config.getLimitRefreshPeriod()))
                .build();
    }

    static Optional<String> limitGroup(String method, String path) {
        if (!"POST".equalsIgnoreCase(method)) {
            return Optional.empty();
        }
        String normalized = stripTrailingSlash(path);
        if ("/api/alerts".equals(normalized)) {
            return Optional.of(ALERT_CREATION);
        }
        if (DECISION_PATH.matcher(normalized).matches()) {
            return Optional.of(APPROVALS);
        }
        return Optional.empty();
    }

    static String endpointKey(String method, String path) {
        String normalized = stripTrailingSlash(path);
        if (DECISION_PATH.matcher(normalized).matches()) {
            normalized = "/api/alerts/*" + normalized.substring(normalized.lastIndexOf('/'));
        }
        return method.toUpperCase(Locale.ROOT) + ":" + normalized;
    }

    private static String stripTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static long ceilSeconds(Duration duration) {
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : Math.max(1, seconds);
    }
}
