package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Two alerts with the same headline in the same region within the duplicate window. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateSuppressionPayload {

    private String alertId;

    private String duplicateAlertId;

    private String headline;

    private String regionCode;
}
