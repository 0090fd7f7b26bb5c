package com.emergencyalerts.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Global delivery outcome counts over a trailing window. */
@Value
@Builder
public class DeliveryStats {

    Instant since;
    long totalAttempts;
    long successCount;
    long failureCount;

    /** 0-100, rounded to one decimal. 100 when there were no attempts. */
    double successRatePercent;

    public static DeliveryStats of(Instant since, long successCount, long failureCount) {
        long total = successCount + failureCount;
        double rate = total == 0 ? 100.0 : Math.round(successCount * 1000.0 / total) / 10.0;
        return DeliveryStats.builder()
                .since(since)
                .totalAttempts(total)
                .successCount(successCount)
                .failureCount(failureCount)
                .successRatePercent(rate)
                .build();
    }
}
