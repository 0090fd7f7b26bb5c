package com.emergencyalerts.reaction;

import com.emergencyalerts.domain.enums.PatternType;
import java.util.Arrays;
import java.util.Optional;

/**
 * Every reaction the external detector can deliver, with its route segment, how its
 * idempotency key is derived, the dashboard event type it produces and the pattern it persists
 * (if any).
 */
public enum ReactionKind {
    DELIVERY_TRIGGER("delivery-trigger", KeyStrategy.WINDOW, "DeliveryTriggered", null),
    SLA_BREACH("delivery-sla-breach", KeyStrategy.WINDOW, "SLABreachDetected", PatternType.SLA_BREACH),
    APPROVAL_TIMEOUT("approval-timeout", KeyStrategy.WINDOW, "ApprovalTimeoutDetected", PatternType.APPROVAL_TIMEOUT),
    GEOGRAPHIC_CLUSTER(
            "geographic-correlation", KeyStrategy.WINDOW, "CorrelationEventDetected", PatternType.GEOGRAPHIC_CLUSTER),
    REGIONAL_HOTSPOT("regional-hotspot", KeyStrategy.WINDOW, "CorrelationEventDetected", PatternType.REGIONAL_HOTSPOT),
    SEVERITY_ESCALATION(
            "severity-escalation", KeyStrategy.WINDOW, "CorrelationEventDetected", PatternType.SEVERITY_ESCALATION),
    DUPLICATE_SUPPRESSION(
            "duplicate-suppression", KeyStrategy.WINDOW, "CorrelationEventDetected", PatternType.DUPLICATE_SUPPRESSION),
    AREA_EXPANSION(
            "area-expansion-suggestion",
            KeyStrategy.WINDOW,
            "CorrelationEventDetected",
            PatternType.AREA_EXPANSION_SUGGESTION),
    ALL_CLEAR("all-clear-suggestion", KeyStrategy.WINDOW, "AllClearSuggested", null),
    EXPIRY_WARNING("expiry-warning", KeyStrategy.WINDOW, "ExpiryWarning", PatternType.EXPIRY_WARNING),
    RATE_SPIKE("rate-spike-detection", KeyStrategy.EVENT, "RateSpikeDetected", null),
    SLA_COUNTDOWN("sla-countdown", KeyStrategy.WINDOW, "SLACountdownUpdate", null),
    RETRY_STORM("delivery-retry-storm", KeyStrategy.WINDOW, "DeliveryRetryStormDetected", null),
    APPROVER_WORKLOAD("approver-workload", KeyStrategy.HOURLY, "ApproverWorkloadAlert", null),
    DELIVERY_SUCCESS_RATE("delivery-success-rate", KeyStrategy.HOURLY, "DeliverySuccessRateDegraded", null);

    /** How an idempotency key is formed for a kind. */
    public enum KeyStrategy {
        /** {@code patternId:entityId:yyyyMMddHHmmss} of a window start derived from the payload. */
        WINDOW,
        /** {@code patternId:eventId} with a fresh id per delivery. Never deduplicated. */
        EVENT,
        /** {@code patternId:entityId:yyyyMMddHH} of the current hour. */
        HOURLY
    }

    private final String route;
    private final KeyStrategy keyStrategy;
    private final String dashboardEventType;
    private final PatternType patternType;

    ReactionKind(String route, KeyStrategy keyStrategy, String dashboardEventType, PatternType patternType) {
        this.route = route;
        this.keyStrategy = keyStrategy;
        this.dashboardEventType = dashboardEventType;
        this.patternType = patternType;
    }

    /** Route segment, also used as the pattern id inside idempotency keys. */
    public String getRoute() {
        return route;
    }

    public KeyStrategy getKeyStrategy() {
        return keyStrategy;
    }

    public String getDashboardEventType() {
        return dashboardEventType;
    }

    public Optional<PatternType> getPatternType() {
        return Optional.ofNullable(patternType);
    }

    public boolean isPersisted() {
        return patternType != null;
    }

    public static Optional<ReactionKind> fromRoute(String route) {
        return Arrays.stream(values()).filter(kind -> kind.route.equals(route)).findFirst();
    }
}
