package com.emergencyalerts.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.emergencyalerts.observability.RequestLoggingFilter;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter(1000);

    @Test
    @DisplayName("Request is passed down the chain and the response left untouched")
    void passesThrough() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/alerts");
        request.setRequestURI("/api/alerts");
        MockHttpServletResponse response = new MockHttpServletResponse();
        response.setStatus(201);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getStatus()).isEqualTo(201);
    }

    @Test
    @DisplayName("Failure inside the chain is logged and rethrown")
    void rethrowsFailures() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/alerts");
        request.setRequestURI("/api/alerts");
        FilterChain failing = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), failing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }
}
