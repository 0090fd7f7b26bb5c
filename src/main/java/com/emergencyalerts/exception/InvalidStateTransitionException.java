package com.emergencyalerts.exception;

import com.emergencyalerts.domain.enums.AlertStatus;
import java.util.Map;
import lombok.Getter;

/**
 * The requested operation is not legal for the alert's current status.
 */
@Getter
public class InvalidStateTransitionException extends BaseException {

    private final AlertStatus currentStatus;
    private final AlertStatus targetStatus;

    public InvalidStateTransitionException(String alertId, AlertStatus currentStatus, AlertStatus targetStatus) {
        this(alertId, currentStatus, targetStatus, null);
    }

    public InvalidStateTransitionException(
            String alertId, AlertStatus currentStatus, AlertStatus targetStatus, String reason) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                String.format(
                        "Alert %s cannot move from %s to %s%s",
                        alertId, currentStatus, targetStatus, reason != null ? ": " + reason : ""),
                Map.of(
                        "alertId", alertId,
                        "currentStatus", currentStatus.name(),
                        "targetStatus", targetStatus.name()));
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }
}
