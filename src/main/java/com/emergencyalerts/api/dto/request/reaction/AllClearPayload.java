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
public class AllClearPayload {

    private String alertId;

    private String headline;

    private Instant deliveredAt;

    private Instant suggestedAt;
}
