package com.emergencyalerts.domain.model;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of reaction ingestion settings.
 */
@Value
@Builder(toBuilder = true)
public class ReactionSettings {

    /** How long a broadcast-only reaction key stays claimed in the dedup cache. */
    Duration dedupTtl;

    /** Bucket width used as the window start of multi-alert correlation keys. */
    Duration correlationWindow;

    /** Lead time before expiry at which an expiry warning window opens. */
    Duration expiryWarningLead;

    /** Alerts per hour above which a rate spike is reported as critical. */
    double rateSpikeCriticalThreshold;

    int duplicateWindowMinutes;

    public static ReactionSettings defaults() {
        return ReactionSettings.builder()
                .dedupTtl(Duration.ofHours(2))
                .correlationWindow(Duration.ofMinutes(15))
                .expiryWarningLead(Duration.ofMinutes(15))
                .rateSpikeCriticalThreshold(100)
                .duplicateWindowMinutes(15)
                .build();
    }
}
