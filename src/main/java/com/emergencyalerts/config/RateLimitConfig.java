package com.emergencyalerts.config;

import com.emergencyalerts.ratelimit.ApiRateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.time.Duration;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j rate limiter configs for the per-user API limits, one shared config per limit
 * group. Limiters are created lazily per user and endpoint from these configs.
 *
 * <p>Properties prefix: {@code emergency-alerts.rate-limit.*}
 */
@Configuration
public class RateLimitConfig {

    @Bean
    public RateLimiterRegistry apiRateLimiterRegistry(
            @Value("${emergency-alerts.rate-limit.window:PT1M}") Duration window,
            @Value("${emergency-alerts.rate-limit.alert-creation-per-window:10}") int alertCreationLimit,
            @Value("${emergency-alerts.rate-limit.approvals-per-window:30}") int approvalsLimit) {
        return RateLimiterRegistry.of(Map.of(
                ApiRateLimiter.ALERT_CREATION, limitPerWindow(alertCreationLimit, window),
                ApiRateLimiter.APPROVALS, limitPerWindow(approvalsLimit, window)));
    }

    static RateLimiterConfig limitPerWindow(int limit, Duration window) {
        return RateLimiterConfig.custom()
                .limitForPeriod(limit)
                .limitRefreshPeriod(window)
                .timeoutDuration(Duration.ZERO)
                .build();
    }
}
