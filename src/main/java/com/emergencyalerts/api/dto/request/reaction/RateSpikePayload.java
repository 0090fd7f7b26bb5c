package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Alert creation rate over the last hour. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateSpikePayload {

    private int alertsInWindow;

    private double creationRatePerHour;
}
