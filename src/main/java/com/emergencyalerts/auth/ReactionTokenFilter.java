package com.emergencyalerts.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Shared-secret authentication for reaction webhooks ({@code /api/reactions/**}).
 *
 * <p>The secret is accepted from {@code X-Reaction-Token} or {@code Authorization: Bearer} and
 * compared in constant time. When no secret is configured every reaction is rejected and the
 * misconfiguration is logged once.
 */
@Component
public class ReactionTokenFilter extends OncePerRequestFilter {

    public static final String REACTION_TOKEN_HEADER = "X-Reaction-Token";

    private static final Logger log = LoggerFactory.getLogger(ReactionTokenFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expectedToken;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean missingSecretLogged = new AtomicBoolean();

    public ReactionTokenFilter(
            @Value("${emergency-alerts.auth.reaction-token:}") String reactionToken, ObjectMapper objectMapper) {
        this.expectedToken = reactionToken == null || reactionToken.isBlank()
                ? null
                : reactionToken.trim().getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/reactions/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (expectedToken == null) {
            if (missingSecretLogged.compareAndSet(false, true)) {
                log.error("Reaction token is not configured (emergency-alerts.auth.reaction-token); "
                        + "rejecting all reaction calls");
            }
            JwtAuthFilter.writeUnauthorized(
                    response, objectMapper, request.getRequestURI(), "Reaction authentication is not configured");
            return;
        }

        String presented = presentedToken(request);
        if (presented == null) {
            JwtAuthFilter.writeUnauthorized(response, objectMapper, request.getRequestURI(), "Missing reaction token");
            return;
        }
        if (!MessageDigest.isEqual(expectedToken, presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Invalid reaction token presented for {}", request.getRequestURI());
            JwtAuthFilter.writeUnauthorized(response, objectMapper, request.getRequestURI(), "Invalid reaction token");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static String presentedToken(HttpServletRequest request) {
        String header = request.getHeader(REACTION_TOKEN_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
