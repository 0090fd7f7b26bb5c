package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.IdGenerator;
import com.emergencyalerts.domain.enums.AttemptOutcome;
import com.emergencyalerts.exception.ValidationException;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One try at delivering an alert to one recipient. Immutable once recorded.
 *
 * <p>A success carries the provider's operation id and no failure reason; a failure carries a
 * reason and no operation id.
 */
@Value
@Builder
public class DeliveryAttempt {

    public static final int DETAIL_MAX_LENGTH = 1000;

    String id;
    String alertId;
    String recipientId;

    /** Which retry this is, starting at 1. Not a sequence index. */
    int attemptNumber;

    AttemptOutcome outcome;
    String failureReason;
    String providerOperationId;
    Instant attemptedAt;

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    public static DeliveryAttempt create(
            String alertId,
            String recipientId,
            int attemptNumber,
            AttemptOutcome outcome,
            String detail,
            Instant attemptedAt,
            IdGenerator ids) {
        if (alertId == null || alertId.isBlank()) {
            throw new ValidationException("alertId", "Alert id is required");
        }
        if (recipientId == null || recipientId.isBlank()) {
            throw new ValidationException("recipientId", "Recipient id is required");
        }
        if (attemptNumber < 1) {
            throw new ValidationException("attemptNumber", "Attempt number must be at least 1");
        }
        if (outcome == null) {
            throw new ValidationException("outcome", "Outcome is required");
        }
        String trimmedDetail = detail == null ? "" : detail.trim();
        if (trimmedDetail.isEmpty()) {
            throw new ValidationException(
                    outcome == AttemptOutcome.SUCCESS ? "providerOperationId" : "failureReason",
                    outcome == AttemptOutcome.SUCCESS
                            ? "A successful attempt requires a provider operation id"
                            : "A failed attempt requires a failure reason");
        }
        if (trimmedDetail.length() > DETAIL_MAX_LENGTH) {
            throw new ValidationException(
                    outcome == AttemptOutcome.SUCCESS ? "providerOperationId" : "failureReason",
                    "Must be at most " + DETAIL_MAX_LENGTH + " characters, got " + trimmedDetail.length());
        }

        return DeliveryAttempt.builder()
                .id(ids.newId())
                .alertId(alertId)
                .recipientId(recipientId)
                .attemptNumber(attemptNumber)
                .outcome(outcome)
                .providerOperationId(outcome == AttemptOutcome.SUCCESS ? trimmedDetail : null)
                .failureReason(outcome == AttemptOutcome.FAILURE ? trimmedDetail : null)
                .attemptedAt(attemptedAt)
                .build();
    }
}
