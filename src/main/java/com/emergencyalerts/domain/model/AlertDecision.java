package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.vo.VersionToken;
import lombok.Builder;
import lombok.Value;

/**
 * Result of an approval decision. The decision itself is always committed when this is
 * returned; delivery is a downstream effect whose failure is reported, not rolled back.
 */
@Value
@Builder
public class AlertDecision {

    Alert alert;
    boolean deliveryRequested;

    /** Why the delivery transport could not be reached. Null when delivery was requested. */
    String deliveryFailureReason;

    public VersionToken getVersionToken() {
        return alert.versionToken();
    }

    public static AlertDecision withoutDelivery(Alert alert) {
        return AlertDecision.builder().alert(alert).deliveryRequested(false).build();
    }
}
