package com.emergencyalerts.auth;

import com.emergencyalerts.domain.enums.UserRole;
import java.util.Arrays;
import java.util.Set;
import lombok.Value;

/** The operator behind a request, as asserted by a verified JWT. */
@Value
public class AuthenticatedUser {

    /** Request attribute under which {@link JwtAuthFilter} stores the user. */
    public static final String REQUEST_ATTRIBUTE = "authenticatedUser";

    String userId;
    Set<UserRole> roles;

    /** ADMIN satisfies every role check. */
    public boolean hasAnyRole(UserRole... required) {
        if (roles.contains(UserRole.ADMIN)) {
            return true;
        }
        return Arrays.stream(required).anyMatch(roles::contains);
    }
}
