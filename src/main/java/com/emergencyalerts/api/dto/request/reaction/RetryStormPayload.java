package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Repeated failed delivery attempts for one alert. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryStormPayload {

    private String alertId;

    private String headline;

    private String severity;

    private int failedAttemptCount;

    private String lastFailureReason;
}
