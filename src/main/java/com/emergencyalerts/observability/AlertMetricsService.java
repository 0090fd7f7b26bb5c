package com.emergencyalerts.observability;

import com.emergencyalerts.event.AlertStatusChangedEvent;
import com.emergencyalerts.event.DeliveryAttemptRecordedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics:
 * <ul>
 *   <li><b>alerts.transitions</b> (counter, tag {@code type}): committed alert writes</li>
 *   <li><b>alerts.approval.conflicts</b> (counter): lost compare-and-swap races and stale tokens</li>
 *   <li><b>delivery.attempts</b> (counter, tag {@code outcome}): ledger appends</li>
 *   <li><b>reactions.processed</b> / <b>reactions.duplicates</b> (counters, tag {@code kind})</li>
 *   <li><b>dashboard.broadcast.failures</b> (counter)</li>
 *   <li><b>api.rate_limited</b> (counter, tag {@code group}): requests refused with 429</li>
 * </ul>
 */
@Service
public class AlertMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter approvalConflictCounter;
    private final Counter broadcastFailureCounter;

    public AlertMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.approvalConflictCounter = Counter.builder("alerts.approval.conflicts")
                .description("Alert writes rejected because another writer changed the alert first")
                .register(meterRegistry);

        this.broadcastFailureCounter = Counter.builder("dashboard.broadcast.failures")
                .description("Dashboard messages that could not be handed to the broker")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onAlertStatusChanged(AlertStatusChangedEvent event) {
        meterRegistry
                .counter("alerts.transitions", "type", event.getEventType().name().toLowerCase(Locale.ROOT))
                .increment();
    }

    @EventListener
    @Order(20)
    public void onDeliveryAttemptRecorded(DeliveryAttemptRecordedEvent event) {
        meterRegistry
                .counter("delivery.attempts", "outcome", event.getAttempt().getOutcome().name().toLowerCase(Locale.ROOT))
                .increment();
    }

    public void recordApprovalConflict() {
        approvalConflictCounter.increment();
    }

    public void recordBroadcastFailure() {
        broadcastFailureCounter.increment();
    }

    public void recordReactionProcessed(String kind) {
        meterRegistry.counter("reactions.processed", "kind", kind).increment();
    }

    public void recordReactionDuplicate(String kind) {
        meterRegistry.counter("reactions.duplicates", "kind", kind).increment();
    }

    public void recordRateLimited(String limitGroup) {
        meterRegistry.counter("api.rate_limited", "group", limitGroup).increment();
    }
}
