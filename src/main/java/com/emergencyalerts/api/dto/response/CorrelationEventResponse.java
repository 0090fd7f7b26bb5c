package com.emergencyalerts.api.dto.response;

import com.emergencyalerts.domain.enums.PatternType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
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
public class CorrelationEventResponse {

    private String id;
    private PatternType patternType;
    private List<String> alertIds;
    private String regionCode;
    private String clusterSeverity;
    private Map<String, Object> metadata;
    private String idempotencyKey;
    private Instant detectedAt;
}
