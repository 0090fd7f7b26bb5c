package com.emergencyalerts.api.dto.request.reaction;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaCountdownPayload {

    private String alertId;

    private String headline;

    private String severity;

    private int secondsElapsed;

    private int secondsRemaining;

    private Instant breachAt;
}
