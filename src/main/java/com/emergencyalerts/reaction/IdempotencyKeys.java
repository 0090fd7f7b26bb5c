package com.emergencyalerts.reaction;

import com.emergencyalerts.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Idempotency key formats for reactions. Pure functions of their inputs: two deliveries of the
 * same detection in the same window yield byte-identical keys.
 */
public final class IdempotencyKeys {

    private static final DateTimeFormatter WINDOW_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter HOUR_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHH").withZone(ZoneOffset.UTC);

    private IdempotencyKeys() {}

    /** {@code patternId:entityId:yyyyMMddHHmmss}, window start in UTC truncated to seconds. */
    public static String window(String patternId, String entityId, Instant windowStart) {
        if (windowStart == null) {
            throw new ValidationException("Window start is required for " + patternId);
        }
        return requirePart(patternId, "patternId") + ":" + requirePart(entityId, "entityId") + ":"
                + WINDOW_FORMAT.format(windowStart.truncatedTo(ChronoUnit.SECONDS));
    }

    /** {@code patternId:eventId}. */
    public static String event(String patternId, String eventId) {
        return requirePart(patternId, "patternId") + ":" + requirePart(eventId, "eventId");
    }

    /** {@code patternId:entityId:yyyyMMddHH} of the UTC hour containing {@code now}. */
    public static String hourly(String patternId, String entityId, Instant now) {
        return requirePart(patternId, "patternId") + ":" + requirePart(entityId, "entityId") + ":"
                + HOUR_FORMAT.format(now);
    }

    /**
     * Floors {@code instant} to a multiple of {@code width} since the epoch. A missing or
     * non-positive width only truncates to seconds.
     */
    public static Instant floor(Instant instant, Duration width) {
        Instant seconds = instant.truncatedTo(ChronoUnit.SECONDS);
        if (width == null || width.isZero() || width.isNegative()) {
            return seconds;
        }
        long widthMillis = width.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(seconds.toEpochMilli(), widthMillis) * widthMillis);
    }

    /** Stable digest of a set of alert ids: order and repeats do not matter. */
    public static String digest(Collection<String> alertIds) {
        return digest(null, alertIds);
    }

    /** Stable digest of a scope (region, target severity) plus a set of alert ids. */
    public static String digest(String scope, Collection<String> alertIds) {
        String ids = alertIds == null
                ? ""
                : alertIds.stream()
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(id -> !id.isEmpty())
                        .distinct()
                        .sorted()
                        .collect(Collectors.joining(","));
        String raw = (scope == null ? "" : scope.trim()) + "|" + ids;
        return sha256(raw);
    }

    private static String requirePart(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name, "Idempotency key part " + name + " is required");
        }
        return value;
    }

    /** First 16 hex characters of SHA-256. */
    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
