package com.emergencyalerts.ratelimit;

import lombok.Builder;
import lombok.Value;

/** Outcome of one rate limit check. An unlimited endpoint is always allowed with no limit. */
@Value
@Builder
public class RateLimitDecision {

    private static final RateLimitDecision UNLIMITED = RateLimitDecision.builder().allowed(true).build();

    boolean allowed;

    /** {@code METHOD:path} with the alert id replaced by {@code *}; null when unlimited. */
    String endpointKey;

    String limitGroup;
    int limit;
    int remaining;
    long retryAfterSeconds;

    public static RateLimitDecision unlimited() {
        return UNLIMITED;
    }

    public boolean isLimited() {
        return limitGroup != null;
    }
}
