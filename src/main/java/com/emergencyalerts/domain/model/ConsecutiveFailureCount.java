package com.emergencyalerts.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Trailing run of failed attempts for one alert since its latest success. */
@Value
@Builder
public class ConsecutiveFailureCount {

    String alertId;
    int consecutiveFailures;
    String lastFailureReason;
    Instant lastAttemptAt;
}
