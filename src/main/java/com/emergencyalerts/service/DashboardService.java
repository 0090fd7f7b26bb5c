package com.emergencyalerts.service;

import com.emergencyalerts.correlation.CorrelationEventStore;
import com.emergencyalerts.delivery.DeliveryAttemptLedger;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.domain.model.DashboardSummary;
import com.emergencyalerts.repository.AlertStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Service;

/**
 * Builds the dashboard's landing snapshot. Subsequent changes reach the dashboard over the
 * broadcast channel.
 */
@Service
public class DashboardService {

    static final int BACKLOG_LIMIT = 10;
    static final int RECENT_CORRELATIONS_LIMIT = 10;
    static final Duration DELIVERY_STATS_WINDOW = Duration.ofHours(1);

    private final AlertStore alertStore;
    private final DeliveryAttemptLedger deliveryAttemptLedger;
    private final CorrelationEventStore correlationEventStore;
    private final AlertPolicy alertPolicy;
    private final Clock clock;

    public DashboardService(
            AlertStore alertStore,
            DeliveryAttemptLedger deliveryAttemptLedger,
            CorrelationEventStore correlationEventStore,
            AlertPolicy alertPolicy,
            Clock clock) {
        this.alertStore = alertStore;
        this.deliveryAttemptLedger = deliveryAttemptLedger;
        this.correlationEventStore = correlationEventStore;
        this.alertPolicy = alertPolicy;
        this.clock = clock;
    }

    public DashboardSummary summary() {
        Instant now = clock.instant();
        return DashboardSummary.builder()
                .statusCounts(alertStore.countByEffectiveStatus(now))
                .approvalTimeouts(alertStore.findPendingCreatedBefore(
                        now.minus(alertPolicy.getApprovalTimeout()), now, BACKLOG_LIMIT))
                .slaBreaches(alertStore.findApprovedDecidedBefore(
                        now.minus(alertPolicy.getDeliverySla()), now, BACKLOG_LIMIT))
                .deliveryStats(deliveryAttemptLedger.statsSince(now.minus(DELIVERY_STATS_WINDOW)))
                .recentCorrelations(correlationEventStore.recent(RECENT_CORRELATIONS_LIMIT))
                .generatedAt(now)
                .build();
    }
}
