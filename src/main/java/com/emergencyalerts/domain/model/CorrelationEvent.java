package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.enums.PatternType;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * A persisted pattern detection over one or more alerts. Written once per idempotency key and
 * never mutated.
 *
 * <p>Alert ids are weak references: the alerts they name may be archived independently.
 */
@Value
@Builder
public class CorrelationEvent {

    String id;
    PatternType patternType;
    List<String> alertIds;
    String regionCode;
    String clusterSeverity;

    /** Opaque JSON; always includes the idempotency key for audit. */
    String metadata;

    String idempotencyKey;
    Instant detectedAt;

    /** Drops nulls, blanks and repeats while keeping first-seen order. */
    public static List<String> distinctAlertIds(Collection<String> alertIds) {
        if (alertIds == null) {
            return List.of();
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        alertIds.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .forEach(distinct::add);
        return List.copyOf(distinct);
    }
}
