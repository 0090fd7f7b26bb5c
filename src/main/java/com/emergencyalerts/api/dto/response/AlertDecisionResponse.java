package com.emergencyalerts.api.dto.response;

import lombok.Builder;
import lombok.Getter;

/**
 * Approval outcome. The alert is approved whenever this is returned; a delivery failure only
 * means the caller may re-trigger delivery.
 */
@Getter
@Builder
public class AlertDecisionResponse {

    private final AlertResponse alert;
    private final String versionToken;
    private final boolean deliveryRequested;
    private final String deliveryFailureReason;
}
