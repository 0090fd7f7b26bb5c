package com.emergencyalerts.api.dto.request;

import com.emergencyalerts.domain.enums.AttemptOutcome;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A delivery attempt reported by the transport. The recipient is named either by id or by
 * email; an unknown email registers a new recipient.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordDeliveryAttemptRequest {

    private String recipientId;

    @Email
    private String recipientEmail;

    private String displayName;

    @Min(1)
    private int attemptNumber;

    @NotNull
    private AttemptOutcome outcome;

    /** Provider's operation id; expected on success. */
    private String providerOperationId;

    /** Expected on failure. */
    private String failureReason;

    /** Defaults to the time the report is received. */
    private Instant attemptedAt;
}
