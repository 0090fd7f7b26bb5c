package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuccessRatePayload {

    private int totalAttempts;

    private int successCount;

    private int failedCount;

    private double successRatePercent;
}
