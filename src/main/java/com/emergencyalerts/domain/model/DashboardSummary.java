package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.enums.AlertStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Point-in-time operational overview shown on the dashboard's landing view. */
@Value
@Builder
public class DashboardSummary {

    Map<AlertStatus, Long> statusCounts;

    /** Alerts waiting for approval longer than the policy's approval timeout, oldest first. */
    List<Alert> approvalTimeouts;

    /** Approved alerts not delivered within the delivery SLA, oldest decision first. */
    List<Alert> slaBreaches;

    DeliveryStats deliveryStats;
    List<CorrelationEvent> recentCorrelations;
    Instant generatedAt;
}
