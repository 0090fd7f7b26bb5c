package com.emergencyalerts.api.dto.response;

import com.emergencyalerts.domain.enums.AttemptOutcome;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryAttemptResponse {

    private String id;
    private String alertId;
    private String recipientId;
    private int attemptNumber;
    private AttemptOutcome outcome;
    private String failureReason;
    private String providerOperationId;
    private Instant attemptedAt;
}
