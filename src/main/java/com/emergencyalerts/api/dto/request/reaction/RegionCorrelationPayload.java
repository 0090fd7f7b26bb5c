package com.emergencyalerts.api.dto.request.reaction;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the geographic-correlation and regional-hotspot reactions. When {@code alertIds} is
 * omitted the live alerts of {@code regionCode} are used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionCorrelationPayload {

    private String regionCode;

    private Integer alertCount;

    private List<String> alertIds;

    private String clusterSeverity;
}
