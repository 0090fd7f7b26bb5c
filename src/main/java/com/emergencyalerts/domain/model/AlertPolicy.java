package com.emergencyalerts.domain.model;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the rules alert operations are validated against.
 *
 * <p>Built once from configuration and handed to every domain call that needs a limit, so the
 * aggregate never reads ambient settings.
 */
@Value
@Builder(toBuilder = true)
public class AlertPolicy {

    int headlineMaxLength;
    int descriptionMaxLength;
    int areaDescriptionMaxLength;
    int rejectionReasonMaxLength;
    String defaultLanguageCode;

    /** Pending alerts older than this show up as approval timeouts on the dashboard. */
    Duration approvalTimeout;

    /** Approved alerts not delivered within this window count as SLA breaches. */
    Duration deliverySla;

    int defaultPageSize;
    int maxPageSize;

    public static AlertPolicy defaults() {
        return AlertPolicy.builder()
                .headlineMaxLength(100)
                .descriptionMaxLength(1395)
                .areaDescriptionMaxLength(255)
                .rejectionReasonMaxLength(500)
                .defaultLanguageCode("en-GB")
                .approvalTimeout(Duration.ofMinutes(5))
                .deliverySla(Duration.ofSeconds(60))
                .defaultPageSize(50)
                .maxPageSize(200)
                .build();
    }
}
