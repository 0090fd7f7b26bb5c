package com.emergencyalerts.domain.model;

import com.emergencyalerts.exception.ValidationException;
import java.time.Instant;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/** A delivery target identified by a unique email address. */
@Value
@Builder
public class Recipient {

    private static final int EMAIL_MAX_LENGTH = 255;

    String id;
    String email;
    String displayName;
    boolean active;
    Instant createdAt;

    /**
     * Trims and lowercases an address so that lookups and the uniqueness constraint agree.
     *
     * @throws ValidationException if the address is blank, too long or has no {@code @}
     */
    public static String normalizeEmail(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new ValidationException("email", "Recipient email is required");
        }
        if (normalized.length() > EMAIL_MAX_LENGTH) {
            throw new ValidationException("email", "Recipient email must be at most " + EMAIL_MAX_LENGTH + " characters");
        }
        if (normalized.indexOf('@') <= 0 || normalized.endsWith("@")) {
            throw new ValidationException("email", "Recipient email is not a valid address");
        }
        return normalized;
    }
}
