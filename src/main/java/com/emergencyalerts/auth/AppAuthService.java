package com.emergencyalerts.auth;

import com.emergencyalerts.domain.enums.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Verifies operator JWTs.
 *
 * <p>Tokens are HS256-signed with {@code emergency-alerts.auth.jwt-secret}. The subject is the
 * user id and the {@code roles} claim lists {@link UserRole} names. Unknown role names are
 * ignored; a token with no subject is rejected.
 */
@Service
public class AppAuthService {

    static final String ROLES_CLAIM = "roles";

    private final SecretKey secretKey;
    private final Clock clock;

    public AppAuthService(@Value("${emergency-alerts.auth.jwt-secret}") String jwtSecret, Clock clock) {
        this.secretKey = new SecretKeySpec(jwtSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.clock = clock;
    }

    /**
     * @return the user the token was issued to
     * @throws JwtException if the token is invalid, expired, tampered or has no subject
     */
    public AuthenticatedUser validateToken(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new JwtException("Token has no subject");
        }
        return new AuthenticatedUser(subject, parseRoles(claims.get(ROLES_CLAIM)));
    }

    /** Issues a token for {@code userId}; used by tooling and tests. */
    public String issueToken(String userId, Collection<UserRole> roles, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId)
                .claim(ROLES_CLAIM, roles.stream().map(Enum::name).toList())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(secretKey)
                .compact();
    }

    private static Set<UserRole> parseRoles(Object claim) {
        Set<UserRole> roles = EnumSet.noneOf(UserRole.class);
        if (!(claim instanceof List<?> names)) {
            return roles;
        }
        for (Object name : names) {
            if (name == null) {
                continue;
            }
            String normalized = name.toString().trim().toUpperCase(Locale.ROOT);
            Arrays.stream(UserRole.values())
                    .filter(role -> role.name().equals(normalized))
                    .findFirst()
                    .ifPresent(roles::add);
        }
        return roles;
    }
}
