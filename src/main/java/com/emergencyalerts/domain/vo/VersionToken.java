package com.emergencyalerts.domain.vo;

import java.util.Optional;
import lombok.EqualsAndHashCode;

/**
 * Opaque optimistic-concurrency precondition for an alert.
 *
 * <p>Backed by the alert's monotonic version counter. Callers only ever see the string form,
 * carried over HTTP as a quoted entity tag. A token that does not parse as a version never
 * matches anything, so a garbled precondition is treated as stale rather than ignored.
 */
@EqualsAndHashCode
public final class VersionToken {

    private final String value;

    private VersionToken(String value) {
        this.value = value;
    }

    public static VersionToken of(long version) {
        return new VersionToken(Long.toString(version));
    }

    /**
     * Reads an {@code If-Match} style header. Absent, blank and wildcard values carry no
     * precondition and yield empty.
     */
    public static Optional<VersionToken> fromHeader(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String token = header.trim();
        if (token.isEmpty() || token.equals("*")) {
            return Optional.empty();
        }
        if (token.startsWith("W/")) {
            token = token.substring(2);
        }
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            token = token.substring(1, token.length() - 1);
        }
        return Optional.of(new VersionToken(token));
    }

    public boolean matches(long version) {
        return value.equals(Long.toString(version));
    }

    public String value() {
        return value;
    }

    public String toEntityTag() {
        return "\"" + value + "\"";
    }

    @Override
    public String toString() {
        return value;
    }
}
