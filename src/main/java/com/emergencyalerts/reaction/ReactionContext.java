package com.emergencyalerts.reaction;

import com.emergencyalerts.api.websocket.DashboardMessage;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.CorrelationEvent;
import com.emergencyalerts.domain.model.ReactionSettings;
import com.emergencyalerts.mapper.JsonHelper;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a reaction handler may read besides its payload. The referenced alert is absent
 * when the reaction names none, when it does not exist, or when the lookup failed.
 */
@Value
@Builder
public class ReactionContext {

    public static final String UNKNOWN_HEADLINE = "Unknown Alert";
    public static final String UNKNOWN_SEVERITY = "Unknown";
    public static final String UNKNOWN_STATUS = "Unknown";

    ReactionKind kind;
    Instant now;
    String idempotencyKey;

    /** Fresh id for this delivery; becomes the correlation event id when one is persisted. */
    String eventId;

    Alert alert;
    ReactionSettings settings;

    public Optional<Alert> findAlert() {
        return Optional.ofNullable(alert);
    }

    /** The provided headline, else the alert's, else the placeholder. */
    public String headlineOr(String provided) {
        if (hasText(provided)) {
            return provided;
        }
        return findAlert().map(Alert::getHeadline).orElse(UNKNOWN_HEADLINE);
    }

    /** The provided severity, else the alert's, else the placeholder. */
    public String severityOr(String provided) {
        if (hasText(provided)) {
            return provided;
        }
        return findAlert().map(a -> a.getSeverity().name()).orElse(UNKNOWN_SEVERITY);
    }

    /** Dashboard message of this kind, stamped with the idempotency key and detection time. */
    public DashboardMessage message(FieldMap payload) {
        return DashboardMessage.of(
                kind.getDashboardEventType(),
                payload.with("idempotencyKey", idempotencyKey).with("detectedAt", now).toMap(),
                now);
    }

    /** Correlation event of this kind's pattern; metadata always carries the idempotency key. */
    public CorrelationEvent correlationEvent(
            List<String> alertIds, String regionCode, String clusterSeverity, FieldMap metadata) {
        return CorrelationEvent.builder()
                .id(eventId)
                .patternType(kind.getPatternType()
                        .orElseThrow(() -> new IllegalStateException(kind + " does not persist a pattern")))
                .alertIds(CorrelationEvent.distinctAlertIds(alertIds))
                .regionCode(regionCode)
                .clusterSeverity(clusterSeverity)
                .metadata(JsonHelper.toJson(metadata.with("idempotencyKey", idempotencyKey).toMap()))
                .idempotencyKey(idempotencyKey)
                .detectedAt(now)
                .build();
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
