package com.emergencyalerts.reaction;

import com.emergencyalerts.api.dto.request.reaction.AllClearPayload;
import com.emergencyalerts.api.dto.request.reaction.ApprovalTimeoutPayload;
import com.emergencyalerts.api.dto.request.reaction.ApproverWorkloadPayload;
import com.emergencyalerts.api.dto.request.reaction.AreaExpansionPayload;
import com.emergencyalerts.api.dto.request.reaction.DeliveryTriggerPayload;
import com.emergencyalerts.api.dto.request.reaction.DuplicateSuppressionPayload;
import com.emergencyalerts.api.dto.request.reaction.ExpiryWarningPayload;
import com.emergencyalerts.api.dto.request.reaction.RateSpikePayload;
import com.emergencyalerts.api.dto.request.reaction.RegionCorrelationPayload;
import com.emergencyalerts.api.dto.request.reaction.RetryStormPayload;
import com.emergencyalerts.api.dto.request.reaction.SeverityEscalationPayload;
import com.emergencyalerts.api.dto.request.reaction.SlaBreachPayload;
import com.emergencyalerts.api.dto.request.reaction.SlaCountdownPayload;
import com.emergencyalerts.api.dto.request.reaction.SuccessRatePayload;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.CorrelationEvent;
import com.emergencyalerts.exception.ValidationException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * The closed set of reaction definitions, one per {@link ReactionKind}.
 *
 * <p>Cardinality guards run in the validators, so a payload naming too few alerts is rejected
 * before anything is keyed, persisted or broadcast.
 */
@Component
public class ReactionTable {

    static final String GLOBAL_ENTITY = "global";
    static final String UNKNOWN_FAILURE_REASON = "Unknown error";
    static final String RATE_SPIKE_CRITICAL = "Critical";
    static final String RATE_SPIKE_WARNING = "Warning";

    private final Map<ReactionKind, ReactionDefinition<?>> definitions = new EnumMap<>(ReactionKind.class);

    public ReactionTable() {
        register(deliveryTrigger());
        register(slaBreach());
        register(approvalTimeout());
        register(regionCorrelation(ReactionKind.GEOGRAPHIC_CLUSTER, 2));
        register(regionCorrelation(ReactionKind.REGIONAL_HOTSPOT, 1));
        register(severityEscalation());
        register(duplicateSuppression());
        register(areaExpansion());
        register(allClear());
        register(expiryWarning());
        register(rateSpike());
        register(slaCountdown());
        register(retryStorm());
        register(approverWorkload());
        register(deliverySuccessRate());

        if (definitions.size() != ReactionKind.values().length) {
            throw new IllegalStateException("Reaction definitions missing for some kinds");
        }
    }

    public ReactionDefinition<?> definition(ReactionKind kind) {
        return definitions.get(kind);
    }

    private void register(ReactionDefinition<?> definition) {
        definitions.put(definition.getKind(), definition);
    }

    // ==================== Single-alert reactions ====================

    private static ReactionDefinition<DeliveryTriggerPayload> deliveryTrigger() {
        return ReactionDefinition.<DeliveryTriggerPayload>builder()
                .kind(ReactionKind.DELIVERY_TRIGGER)
                .payloadType(DeliveryTriggerPayload.class)
                .validator(p -> requireId(p.getAlertId(), "alertId"))
                .keyInput((p, now, settings) -> KeyInput.of(p.getAlertId(), now))
                .alertRef(DeliveryTriggerPayload::getAlertId)
                .handler((p, ctx) -> ReactionOutcome.broadcast(ctx.message(FieldMap.create()
                        .with("alertId", p.getAlertId())
                        .with("headline", ctx.headlineOr(null))
                        .with("severity", ctx.severityOr(null))
                        .with("status", ctx.findAlert()
                                .map(a -> a.getStatus().name())
                                .orElse(ReactionContext.UNKNOWN_STATUS)))))
                .build();
    }

    private static ReactionDefinition<SlaBreachPayload> slaBreach() {
        return ReactionDefinition.<SlaBreachPayload>builder()
                .kind(ReactionKind.SLA_BREACH)
                .payloadType(SlaBreachPayload.class)
                .validator(p -> {
                    requireId(p.getAlertId(), "alertId");
                    requireNonNegative(p.getElapsedSeconds(), "elapsedSeconds");
                })
                .keyInput((p, now, settings) ->
                        KeyInput.of(p.getAlertId(), now.minusSeconds(p.getElapsedSeconds())))
                .alertRef(p -> needsLookup(p.getHeadline(), p.getSeverity()) ? p.getAlertId() : null)
                .handler((p, ctx) -> {
                    String headline = ctx.headlineOr(p.getHeadline());
                    String severity = ctx.severityOr(p.getSeverity());
                    CorrelationEvent event = ctx.correlationEvent(
                            List.of(p.getAlertId()),
                            null,
                            severity,
                            FieldMap.create()
                                    .with("headline", headline)
                                    .with("elapsedSeconds", p.getElapsedSeconds()));
                    return ReactionOutcome.persistAndBroadcast(event, ctx.message(FieldMap.create()
                            .with("alertId", p.getAlertId())
                            .with("headline", headline)
                            .with("severity", severity)
                            .with("elapsedSeconds", p.getElapsedSeconds())));
                })
                .build();
    }

    private static ReactionDefinition<ApprovalTimeoutPayload> approvalTimeout() {
        return ReactionDefinition.<ApprovalTimeoutPayload>builder()
                .kind(ReactionKind.APPROVAL_TIMEOUT)
                .payloadType(ApprovalTimeoutPayload.class)
                .validator(p -> {
                    requireId(p.getAlertId(), "alertId");
                    requireNonNegative(p.getElapsedMinutes(), "elapsedMinutes");
                })
                .keyInput((p, now, settings) ->
                        KeyInput.of(p.getAlertId(), now.minus(Duration.ofMinutes(p.getElapsedMinutes()))))
                .alertRef(ApprovalTimeoutPayload::getAlertId)
                .handler((p, ctx) -> {
                    String headline = ctx.headlineOr(null);
                    String severity = ctx.severityOr(null);
                    Instant createdAt = ctx.findAlert().map(Alert::getCreatedAt).orElse(null);
                    CorrelationEvent event = ctx.correlationEvent(
                            List.of(p.getAlertId()),
                            null,
                            severity,
                            FieldMap.create()
                                    .with("headline", headline)
                                    .with("elapsedMinutes", p.getElapsedMinutes()));
                    return ReactionOutcome.persistAndBroadcast(event, ctx.message(FieldMap.create()
                            .with("alertId", p.getAlertId())
                            .with("headline", headline)
                            .with("severity", severity)
                            .with("createdAt", createdAt)
                            .with("elapsedMinutes", p.getElapsedMinutes())));
                })
                .build();
    }

    private static ReactionDefinition<AllClearPayload> allClear() {
        return ReactionDefinition.<AllClearPayload>builder()
                .kind(ReactionKind.ALL_CLEAR)
                .payloadType(AllClearPayload.class)
                .validator(p -> requireId(p.getAlertId(), "alertId"))
                .keyInput((p, now, settings) -> KeyInput.of(p.getAlertId(), firstNonNull(
                        p.getDeliveredAt(), p.getSuggestedAt(), now)))
                .alertRef(p -> needsLookup(p.getHeadline()) || p.getDeliveredAt() == null ? p.getAlertId() : null)
                .handler((p, ctx) -> ReactionOutcome.broadcast(ctx.message(FieldMap.create()
                        .with("alertId", p.getAlertId())
                        .with("headline", ctx.headlineOr(p.getHeadline()))
                        .with("deliveredAt", p.getDeliveredAt() != null
                                ? p.getDeliveredAt()
                                : ctx.findAlert().map(Alert::getDeliveredAt).orElse(null))
                        .with("suggestedAt", p.getSuggestedAt() != null ? p.getSuggestedAt() : ctx.getNow()))))
                .build();
    }

    private static ReactionDefinition<ExpiryWarningPayload> expiryWarning() {
        return ReactionDefinition.<ExpiryWarningPayload>builder()
                .kind(ReactionKind.EXPIRY_WARNING)
                .payloadType(ExpiryWarningPayload.class)
                .validator(p -> {
                    requireId(p.getAlertId(), "alertId");
                    if (p.getExpiresAt() == null) {
                        throw new ValidationException("expiresAt", "expiresAt is required");
                    }
                })
                .keyInput((p, now, settings) ->
                        KeyInput.of(p.getAlertId(), p.getExpiresAt().minus(settings.getExpiryWarningLead())))
                .alertRef(ExpiryWarningPayload::getAlertId)
                .handler((p, ctx) -> {
                    String headline = ctx.headlineOr(null);
                    String severity = ctx.severityOr(null);
                    long minutesRemaining = Math.max(
                            0, Duration.between(ctx.getNow(), p.getExpiresAt()).toMinutes());
                    CorrelationEvent event = ctx.correlationEvent(
                            List.of(p.getAlertId()),
                            null,
                            severity,
                            FieldMap.create().with("headline", headline).with("expiresAt", p.getExpiresAt()));
                    return ReactionOutcome.persistAndBroadcast(event, ctx.message(FieldMap.create()
                            .with("alertId", p.getAlertId())
                            .with("headline", headline)
                            .with("severity", severity)
                            .with("expiresAt", p.getExpiresAt())
                            .with("minutesRemaining", minutesRemaining)));
                })
                .build();
    }

    private static ReactionDefinition<SlaCountdownPayload> slaCountdown() {
        return ReactionDefinition.<SlaCountdownPayload>builder()
                .kind(ReactionKind.SLA_COUNTDOWN)
                .payloadType(SlaCountdownPayload.class)
                .validator(p -> {
                    requireId(p.getAlertId(), "alertId");
                    requireNonNegative(p.getSecondsElapsed(), "secondsElapsed");
                })
                .keyInput((p, now, settings) ->
                        KeyInput.of(p.getAlertId(), now.minusSeconds(p.getSecondsElapsed())))
                .alertRef(p -> needsLookup(p.getHeadline(), p.getSeverity()) ? p.getAlertId() : null)
                .handler((p, ctx) -> ReactionOutcome.broadcast(ctx.message(FieldMap.create()
                        .with("alertId", p.getAlertId())
                        .with("headline", ctx.headlineOr(p.getHeadline()))
                        .with("severity", ctx.severityOr(p.getSeverity()))
                        .with("secondsElapsed", p.getSecondsElapsed())
                        .with("secondsRemaining", p.getSecondsRemaining())
                        .with("breachAt", p.getBreachAt()))))
                .build();
    }

    private static ReactionDefinition<RetryStormPayload> retryStorm() {
        return ReactionDefinition.<RetryStormPayload>builder()
                .kind(ReactionKind.RETRY_STORM)
                .payloadType(RetryStormPayload.class)
                .validator(p -> {
                    requireId(p.getAlertId(), "alertId");
                    requireNonNegative(p.getFailedAttemptCount(), "failedAttemptCount");
                })
                .keyInput((p, now, settings) ->
                        KeyInput.of(p.getAlertId(), IdempotencyKeys.floor(now, settings.getCorrelationWindow())))
                .alertRef(p -> needsLookup(p.getHeadline(), p.getSeverity()) ? p.getAlertId() : null)
                .handler((p, ctx) -> ReactionOutcome.broadcast(ctx.message(FieldMap.create()
                        .with("alertId", p.getAlertId())
                        .with("headline", ctx.headlineOr(p.getHeadline()))
                        .with("severity", ctx.severityOr(p.getSeverity()))
                        .with("failedAttemptCount", p.getFailedAttemptCount())
                        .with("lastFailureReason", ReactionContext.hasText(p.getLastFailureReason())
                                ? p.getLastFailureReason()
                                : UNKNOWN_FAILURE_REASON))))
                .build();
    }

    // ==================== Multi-alert patterns ====================

    private static ReactionDefinition<RegionCorrelationPayload> regionCorrelation(
            ReactionKind kind, int minimumAlerts) {
        return ReactionDefinition.<RegionCorrelationPayload>builder()
                .kind(kind)
                .payloadType(RegionCorrelationPayload.class)
                .validator(p -> {
                    if (kind == ReactionKind.REGIONAL_HOTSPOT) {
                        requireId(p.getRegionCode(), "regionCode");
                    }
                    requireDistinctAlerts(p.getAlertIds(), minimumAlerts, kind);
                })
                .keyInput((p, now, settings) -> KeyInput.of(
                        IdempotencyKeys.digest(p.getRegionCode(), p.getAlertIds()),
                        IdempotencyKeys.floor(now, settings.getCorrelationWindow())))
                .handler((p, ctx) -> {
                    List<String> alertIds = CorrelationEvent.distinctAlertIds(p.getAlertIds());
                    CorrelationEvent event = ctx.correlationEvent(
                            alertIds,
                            p.getRegionCode(),
                            p.getClusterSeverity(),
                            FieldMap.create().with("alertCount", alertIds.size()));
                    return ReactionOutcome.persistAndBroadcast(event, ctx.message(FieldMap.create()
                            .with("eventId", event.getId())
                            .with("patternType", event.getPatternType().name())
                            .with("regionCode", p.getRegionCode())
                            .with("alertIds", alertIds)
                            .with("alertCount", alertIds.size())
                            .with("clusterSeverity", p.getClusterSeverity())));
                })
                .build();
    }

    private static ReactionDefinition<SeverityEscalationPayload> severityEscalation() {
        return ReactionDefinition.<SeverityEscalationPayload>builder()
                .kind(ReactionKind.SEVERITY_ESCALATION)
                .payloadType(SeverityEscalationPayload.class)
                .validator(p -> {
                    requireDistinctAlerts(p.getAlertIds(), 1, ReactionKind.SEVERITY_ESCALATION);
                    requireId(p.getFromSeverity(), "fromSeverity");
                    requireId(p.getToSeverity(), "toSeverity");
                })
                .keyInput((p, now, settings) -> KeyInput.of(
                        IdempotencyKeys.digest(p.getToSeverity(), p.getAlertIds()),
                        IdempotencyKeys.floor(now, settings.getCorrelationWindow())))
                .handler((p, ctx) -> {
                    List<String> alertIds = CorrelationEvent.distinctAlertIds(p.getAlertIds());
                    String escalation = p.getFromSeverity() + " → " + p.getToSeverity();
                    CorrelationEvent event = ctx.correlationEvent(
                            alertIds,
                            null,
                            p.getToSeverity(),
                            FieldMap.create()
                                    .with("fromSeverity", p.getFromSeverity())
                                    .with("toSeverity", p.getToSeverity())
                                    .with("escalation", escalation));
                    return ReactionOutcome.persistAndBroadcast(event, ctx.message(FieldMap.create()
                            .with("eventId", event.getId())
                            .with("patternType", event.getPatternType().name())
                            .with("alertIds", alertIds)
                            .with("escalation", escalation)));
                })
                .build();
    }

    private static ReactionDefinition<DuplicateSuppressionPayload> duplicateSuppression() {
        return ReactionDefinition.<DuplicateSuppressionPayload>builder()
                .kind(ReactionKind.DUPLICATE_SUPPRESSION)
                .payloadType(DuplicateSuppressionPayload.class)
                .validator(p -> {
                    requireId(p.getAlertId(), "alertId");
                    requireId(p.getDuplicateAlertId(), "duplicateAlertId");
                    requireId(p.getRegionCode(), "regionCode");
                    requireDistinctAlerts(
                            Arrays.asList(p.getAlertId(), p.getDuplicateAlertId()),
                            2,
                            ReactionKind.DUPLICATE_SUPPRESSION);
                })
                .keyInput((p, now, settings) -> KeyInput.of(
                        IdempotencyKeys.digest(p.getRegionCode(), List.of(p.getAlertId(), p.getDuplicateAlertId())),
                        IdempotencyKeys.floor(now, settings.getCorrelationWindow())))
                .handler((p, ctx) -> {
                    List<String> alertIds = List.of(p.getAlertId(), p.getDuplicateAlertId());
                    CorrelationEvent event = ctx.correlationEvent(
                            alertIds,
                            p.getRegionCode(),
                            null,
                            FieldMap.create()
                                    .with("headline", p.getHeadline())
                                    .with("regionCode", p.getRegionCode())
                                    .with("duplicateAlertId", p.getDuplicateAlertId())
                                    .with("windowMinutes", ctx.getSettings().getDuplicateWindowMinutes()));
                    return ReactionOutcome.persistAndBroadcast(event, ctx.message(FieldMap.create()
                            .with("eventId", event.getId())
                            .with("patternType", event.getPatternType().name())
                            .with("alertIds", alertIds)
                            .with("headline", p.getHeadline())
                            .with("regionCode", p.getRegionCode())));
                })
                .build();
    }

    private static ReactionDefinition<AreaExpansionPayload> areaExpansion() {
        return ReactionDefinition.<AreaExpansionPayload>builder()
                .kind(ReactionKind.AREA_EXPANSION)
                .payloadType(AreaExpansionPayload.class)
                .validator(p -> {
                    requireDistinctAlerts(p.getAlertIds(), 2, ReactionKind.AREA_EXPANSION);
                    if (CorrelationEvent.distinctAlertIds(p.getRegionCodes()).size() < 2) {
                        throw new ValidationException(
                                "regionCodes", "Area expansion requires at least 2 distinct regions");
                    }
                })
                .keyInput((p, now, settings) -> KeyInput.of(
                        IdempotencyKeys.digest(p.getAlertIds()),
                        IdempotencyKeys.floor(now, settings.getCorrelationWindow())))
                .handler((p, ctx) -> {
                    List<String> alertIds = CorrelationEvent.distinctAlertIds(p.getAlertIds());
                    List<String> regionCodes = CorrelationEvent.distinctAlertIds(p.getRegionCodes());
                    CorrelationEvent event = ctx.correlationEvent(
                            alertIds,
                            null,
                            null,
                            FieldMap.create().with("headline", p.getHeadline()).with("regionCodes", regionCodes));
                    return ReactionOutcome.persistAndBroadcast(event, ctx.message(FieldMap.create()
                            .with("eventId", event.getId())
                            .with("patternType", event.getPatternType().name())
                            .with("alertIds", alertIds)
                            .with("headline", p.getHeadline())
                            .with("regionCodes", regionCodes)));
                })
                .build();
    }

    // ==================== System-wide signals ====================

    private static ReactionDefinition<RateSpikePayload> rateSpike() {
        return ReactionDefinition.<RateSpikePayload>builder()
                .kind(ReactionKind.RATE_SPIKE)
                .payloadType(RateSpikePayload.class)
                .validator(p -> {
                    requireNonNegative(p.getAlertsInWindow(), "alertsInWindow");
                    requireNonNegative(p.getCreationRatePerHour(), "creationRatePerHour");
                })
                .handler((p, ctx) -> ReactionOutcome.broadcast(ctx.message(FieldMap.create()
                        .with("alertsInOneHourWindow", p.getAlertsInWindow())
                        .with("creationRatePerHour", round(p.getCreationRatePerHour(), 100))
                        .with("severity", p.getCreationRatePerHour() > ctx.getSettings().getRateSpikeCriticalThreshold()
                                ? RATE_SPIKE_CRITICAL
                                : RATE_SPIKE_WARNING))))
                .build();
    }

    private static ReactionDefinition<ApproverWorkloadPayload> approverWorkload() {
        return ReactionDefinition.<ApproverWorkloadPayload>builder()
                .kind(ReactionKind.APPROVER_WORKLOAD)
                .payloadType(ApproverWorkloadPayload.class)
                .validator(p -> {
                    requireId(p.getApproverId(), "approverId");
                    requireNonNegative(p.getDecisionsInHour(), "decisionsInHour");
                })
                .keyInput((p, now, settings) -> KeyInput.entity(p.getApproverId()))
                .handler((p, ctx) -> ReactionOutcome.broadcast(ctx.message(FieldMap.create()
                        .with("approverId", p.getApproverId())
                        .with("decisionsInHour", p.getDecisionsInHour())
                        .with("approvedCount", p.getApprovedCount())
                        .with("rejectedCount", p.getRejectedCount())
                        .with("workloadLevel", p.getWorkloadLevel()))))
                .build();
    }

    private static ReactionDefinition<SuccessRatePayload> deliverySuccessRate() {
        return ReactionDefinition.<SuccessRatePayload>builder()
                .kind(ReactionKind.DELIVERY_SUCCESS_RATE)
                .payloadType(SuccessRatePayload.class)
                .validator(p -> {
                    requireNonNegative(p.getTotalAttempts(), "totalAttempts");
                    if (p.getSuccessRatePercent() < 0 || p.getSuccessRatePercent() > 100) {
                        throw new ValidationException("successRatePercent", "successRatePercent must be 0-100");
                    }
                })
                .keyInput((p, now, settings) -> KeyInput.entity(GLOBAL_ENTITY))
                .handler((p, ctx) -> ReactionOutcome.broadcast(ctx.message(FieldMap.create()
                        .with("totalAttempts", p.getTotalAttempts())
                        .with("successCount", p.getSuccessCount())
                        .with("failedCount", p.getFailedCount())
                        .with("successRatePercent", round(p.getSuccessRatePercent(), 10)))))
                .build();
    }

    // ==================== Helpers ====================

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
    }

    private static void requireNonNegative(double value, String field) {
        if (value < 0 || Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValidationException(field, field + " must be a non-negative number");
        }
    }

    private static void requireDistinctAlerts(List<String> alertIds, int minimum, ReactionKind kind) {
        int distinct = CorrelationEvent.distinctAlertIds(alertIds).size();
        if (distinct < minimum) {
            throw new ValidationException(
                    "alertIds",
                    String.format("%s requires at least %d distinct alerts, got %d", kind.getRoute(), minimum, distinct));
        }
    }

    private static boolean needsLookup(String... provided) {
        return Arrays.stream(provided).anyMatch(value -> !ReactionContext.hasText(value));
    }

    private static Instant firstNonNull(Instant... candidates) {
        return Arrays.stream(candidates).filter(Objects::nonNull).findFirst().orElseThrow();
    }

    private static double round(double value, int scale) {
        return Math.round(value * scale) / (double) scale;
    }
}
