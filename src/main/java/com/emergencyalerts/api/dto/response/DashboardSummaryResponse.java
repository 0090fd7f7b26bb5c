package com.emergencyalerts.api.dto.response;

import com.emergencyalerts.domain.model.DeliveryStats;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Aggregated dashboard data returned by GET /api/dashboard/summary.
 *
 * <p>Combines alert counts, the approval and delivery backlogs, last-hour delivery health and
 * the latest correlation events so the dashboard can render its landing view in one call.
 * Later changes arrive over the STOMP channel.
 */
@Getter
@Builder
public class DashboardSummaryResponse {

    /** Alert counts keyed by effective status name. */
    private final Map<String, Long> statusCounts;

    private final List<AlertResponse> approvalTimeouts;
    private final List<AlertResponse> slaBreaches;
    private final DeliveryStats deliveryStats;
    private final List<CorrelationEventResponse> recentCorrelations;
    private final Instant generatedAt;
}
