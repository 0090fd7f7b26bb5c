package com.emergencyalerts.auth;

import com.emergencyalerts.api.dto.response.ApiErrorResponse;
import com.emergencyalerts.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.JwtException;
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
 * JWT authentication for the operator API ({@code /api/**}).
 *
 * <p>Reaction webhooks ({@code /api/reactions/**}) carry a shared secret instead and are left
 * to {@link ReactionTokenFilter}. On success the verified {@link AuthenticatedUser} is stored
 * as a request attribute; otherwise a 401 JSON error is written and the chain stops.
 *
 * <p>Registered as a servlet filter via {@link com.emergencyalerts.config.WebConfig}.
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final AppAuthService appAuthService;
    private final ObjectMapper objectMapper;

    public JwtAuthFilter(AppAuthService appAuthService, ObjectMapper objectMapper) {
        this.appAuthService = appAuthService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/api/reactions/") || path.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            writeUnauthorized(response, objectMapper, request.getRequestURI(), "Missing or invalid Authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();

        try {
            AuthenticatedUser user = appAuthService.validateToken(token);
            request.setAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE, user);
            filterChain.doFilter(request, response);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT validation failed: {}", e.getMessage());
            writeUnauthorized(response, objectMapper, request.getRequestURI(), "Invalid or expired token");
        }
    }

    static void writeUnauthorized(HttpServletResponse response, ObjectMapper objectMapper, String path, String message)
            throws IOException {
        ApiErrorResponse errorResponse = ApiErrorResponse.of(ErrorCode.UNAUTHORIZED, message, Map.of(), path);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), errorResponse);
    }
}
