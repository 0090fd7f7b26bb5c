package com.emergencyalerts.unit.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.emergencyalerts.auth.AppAuthService;
import com.emergencyalerts.auth.AuthenticatedUser;
import com.emergencyalerts.domain.enums.UserRole;
import com.emergencyalerts.support.AlertFixtures;
import com.emergencyalerts.support.MutableClock;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AppAuthServiceTest {

    private static final String SECRET = "test-secret-that-is-at-least-32-bytes-long";

    private MutableClock clock;
    private AppAuthService appAuthService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(AlertFixtures.NOW);
        appAuthService = new AppAuthService(SECRET, clock);
    }

    @Test
    @DisplayName("Issued token validates to the same user and roles")
    void issuedTokenValidates() {
        String token = appAuthService.issueToken(
                "ap-1", List.of(UserRole.APPROVER, UserRole.OPERATOR), Duration.ofHours(1));

        AuthenticatedUser user = appAuthService.validateToken(token);

        assertThat(user.getUserId()).isEqualTo("ap-1");
        assertThat(user.getRoles()).containsExactlyInAnyOrder(UserRole.APPROVER, UserRole.OPERATOR);
        assertThat(user.hasAnyRole(UserRole.APPROVER)).isTrue();
        assertThat(user.hasAnyRole(UserRole.ADMIN)).isFalse();
    }

    @Test
    @DisplayName("Expired token is rejected")
    void expiredTokenRejected() {
        String token = appAuthService.issueToken("ap-1", List.of(UserRole.APPROVER), Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> appAuthService.validateToken(token)).isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    @DisplayName("Token signed with another secret is rejected")
    void foreignSignatureRejected() {
        AppAuthService other = new AppAuthService("another-secret-that-is-also-32-bytes-long", clock);
        String token = other.issueToken("ap-1", List.of(UserRole.ADMIN), Duration.ofHours(1));

        assertThatThrownBy(() -> appAuthService.validateToken(token)).isInstanceOf(JwtException.class);
    }

    @Test
    @DisplayName("Unknown role names are ignored and case does not matter")
    void unknownRolesIgnored() {
        String token = Jwts.builder()
                .subject("op-1")
                .claim("roles", List.of("operator", "SUPERUSER"))
                .expiration(Date.from(AlertFixtures.NOW.plusSeconds(600)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThat(appAuthService.validateToken(token).getRoles()).containsExactly(UserRole.OPERATOR);
    }

    @Test
    @DisplayName("Token without a subject is rejected")
    void missingSubjectRejected() {
        String token = Jwts.builder()
                .claim("roles", List.of("ADMIN"))
                .expiration(Date.from(AlertFixtures.NOW.plusSeconds(600)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThatThrownBy(() -> appAuthService.validateToken(token))
                .isInstanceOf(JwtException.class)
                .hasMessageContaining("subject");
    }
}
