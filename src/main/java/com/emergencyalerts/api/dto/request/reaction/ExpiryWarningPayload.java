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
public class ExpiryWarningPayload {

    private String alertId;

    private Instant expiresAt;
}
