package com.emergencyalerts.reaction;

import com.emergencyalerts.correlation.CorrelationEventStore;
import com.emergencyalerts.domain.IdGenerator;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.CorrelationEvent;
import com.emergencyalerts.domain.model.ReactionSettings;
import com.emergencyalerts.exception.ValidationException;
import com.emergencyalerts.notification.DashboardBroadcaster;
import com.emergencyalerts.observability.AlertMetricsService;
import com.emergencyalerts.repository.AlertStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns external detections into persisted correlation events and dashboard broadcasts.
 *
 * <p>Processing order for every kind:
 * <ol>
 *   <li>Validate the payload (cardinality guards included).</li>
 *   <li>Derive the idempotency key.</li>
 *   <li>Look up the referenced alert, if the kind needs one. A missing alert or a failed
 *       lookup leaves the context without an alert and the handler uses placeholders.</li>
 *   <li>Build the outcome (pure).</li>
 *   <li>Claim the key: insert-if-absent for persisted kinds, a Redis claim for other keyed
 *       kinds, nothing for event-keyed kinds.</li>
 *   <li>Broadcast, only if the claim succeeded.</li>
 * </ol>
 *
 * <p>Storage failures propagate; broadcast failures never do.
 */
@Service
public class ReactionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ReactionDispatcher.class);

    private final ReactionTable reactionTable;
    private final CorrelationEventStore correlationEventStore;
    private final IdempotencyService idempotencyService;
    private final AlertStore alertStore;
    private final DashboardBroadcaster dashboardBroadcaster;
    private final AlertMetricsService alertMetricsService;
    private final ReactionSettings reactionSettings;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public ReactionDispatcher(
            ReactionTable reactionTable,
            CorrelationEventStore correlationEventStore,
            IdempotencyService idempotencyService,
            AlertStore alertStore,
            DashboardBroadcaster dashboardBroadcaster,
            AlertMetricsService alertMetricsService,
            ReactionSettings reactionSettings,
            IdGenerator idGenerator,
            Clock clock) {
        this.reactionTable = reactionTable;
        this.correlationEventStore = correlationEventStore;
        this.idempotencyService = idempotencyService;
        this.alertStore = alertStore;
        this.dashboardBroadcaster = dashboardBroadcaster;
        this.alertMetricsService = alertMetricsService;
        this.reactionSettings = reactionSettings;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /** Payload class expected for {@code kind}. */
    public Class<?> payloadType(ReactionKind kind) {
        return reactionTable.definition(kind).getPayloadType();
    }

    public ReactionReceipt dispatch(ReactionKind kind, Object payload) {
        if (payload == null) {
            throw new ValidationException("Reaction payload is required");
        }
        return run(reactionTable.definition(kind), payload);
    }

    private <P> ReactionReceipt run(ReactionDefinition<P> definition, Object rawPayload) {
        ReactionKind kind = definition.getKind();
        if (!definition.getPayloadType().isInstance(rawPayload)) {
            throw new ValidationException("Unexpected payload for " + kind.getRoute());
        }
        P payload = definition.getPayloadType().cast(rawPayload);

        definition.getValidator().accept(payload);

        Instant now = clock.instant();
        String eventId = idGenerator.newId();
        String key = definition.idempotencyKey(payload, now, eventId, reactionSettings);

        ReactionContext context = ReactionContext.builder()
                .kind(kind)
                .now(now)
                .idempotencyKey(key)
                .eventId(eventId)
                .alert(lookupAlert(kind, definition.alertIdFor(payload)).orElse(null))
                .settings(reactionSettings)
                .build();

        ReactionOutcome outcome = definition.getHandler().apply(payload, context);

        if (!claim(kind, key, outcome)) {
            alertMetricsService.recordReactionDuplicate(metricTag(kind));
            log.info("Duplicate {} reaction ignored: {}", kind.getRoute(), key);
            return ReactionReceipt.duplicate(kind, key);
        }

        dashboardBroadcaster.publish(outcome.getMessage());
        alertMetricsService.recordReactionProcessed(metricTag(kind));
        log.info("Processed {} reaction: {}", kind.getRoute(), key);
        return ReactionReceipt.processed(kind, key);
    }

    private boolean claim(ReactionKind kind, String key, ReactionOutcome outcome) {
        Optional<CorrelationEvent> event = outcome.getCorrelationEvent();
        if (event.isPresent()) {
            return correlationEventStore.insertIfAbsent(event.get()).isPresent();
        }
        if (kind.getKeyStrategy() == ReactionKind.KeyStrategy.EVENT) {
            return true;
        }
        return idempotencyService.claim(key);
    }

    private Optional<Alert> lookupAlert(ReactionKind kind, String alertId) {
        if (alertId == null || alertId.isBlank()) {
            return Optional.empty();
        }
        try {
            Optional<Alert> alert = alertStore.findById(alertId);
            if (alert.isEmpty()) {
                log.warn("Alert {} referenced by {} reaction not found, using placeholders", alertId, kind.getRoute());
            }
            return alert;
        } catch (RuntimeException e) {
            log.warn(
                    "Alert lookup for {} reaction failed for {}, using placeholders: {}",
                    kind.getRoute(),
                    alertId,
                    e.getMessage());
            return Optional.empty();
        }
    }

    private static String metricTag(ReactionKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
