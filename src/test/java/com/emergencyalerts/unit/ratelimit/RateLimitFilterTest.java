package com.emergencyalerts.unit.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.emergencyalerts.auth.AuthenticatedUser;
import com.emergencyalerts.domain.enums.UserRole;
import com.emergencyalerts.observability.AlertMetricsService;
import com.emergencyalerts.ratelimit.ApiRateLimiter;
import com.emergencyalerts.ratelimit.RateLimitFilter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitFilterTest {

    private static final AuthenticatedUser OPERATOR = new AuthenticatedUser("op-1", Set.of(UserRole.OPERATOR));

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private SimpleMeterRegistry meterRegistry;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        RateLimiterConfig onePerMinute = RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build();
        meterRegistry = new SimpleMeterRegistry();
        filter = new RateLimitFilter(
                new ApiRateLimiter(RateLimiterRegistry.of(Map.of(
                        ApiRateLimiter.ALERT_CREATION, onePerMinute,
                        ApiRateLimiter.APPROVALS, onePerMinute))),
                new AlertMetricsService(meterRegistry),
                objectMapper);
    }

    private static MockHttpServletRequest request(String method, String uri, AuthenticatedUser user) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        request.setRequestURI(uri);
        if (user != null) {
            request.setAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE, user);
        }
        return request;
    }

    @Test
    @DisplayName("Request within the limit passes with limit headers")
    void withinLimitPasses() throws Exception {
        MockHttpServletRequest request = request("POST", "/api/alerts", OPERATOR);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("1");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");
    }

    @Test
    @DisplayName("Request over the limit stops with 429, Retry-After and a RATE_LIMITED body")
    void overLimitRefused() throws Exception {
        filter.doFilter(request("POST", "/api/alerts", OPERATOR), new MockHttpServletResponse(), new MockFilterChain());
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("POST", "/api/alerts", OPERATOR), response, chain);

        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(chain.getRequest()).isNull();
        assertThat(response.getHeader("Retry-After")).isEqualTo("60");
        JsonNode error = objectMapper.readTree(response.getContentAsByteArray()).path("error");
        assertThat(error.path("code").asText()).isEqualTo("RATE_LIMITED");
        assertThat(error.path("path").asText()).isEqualTo("/api/alerts");
        assertThat(error.path("details").path("limit").asInt()).isEqualTo(1);
        assertThat(meterRegistry.counter("api.rate_limited", "group", ApiRateLimiter.ALERT_CREATION).count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Requests without an authenticated user are not counted")
    void anonymousPassesThrough() throws Exception {
        for (int i = 0; i < 3; i++) {
            MockHttpServletResponse response = new MockHttpServletResponse();
            MockFilterChain chain = new MockFilterChain();

            filter.doFilter(request("POST", "/api/alerts", null), response, chain);

            assertThat(chain.getRequest()).isNotNull();
            assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
        }
    }

    @Test
    @DisplayName("Unlimited endpoints get no limit headers")
    void unlimitedEndpointHasNoHeaders() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("GET", "/api/alerts/a-1", OPERATOR), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
    }
}
