package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalTimeoutPayload {

    private String alertId;

    private int elapsedMinutes;
}
