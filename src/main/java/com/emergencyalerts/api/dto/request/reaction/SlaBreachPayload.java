package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An approved alert has not been delivered within the SLA. Headline and severity are optional;
 * missing values are filled from the alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaBreachPayload {

    private String alertId;

    private String headline;

    private String severity;

    private int elapsedSeconds;
}
