package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.IdGenerator;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.enums.ChannelType;
import com.emergencyalerts.domain.enums.Severity;
import com.emergencyalerts.domain.vo.VersionToken;
import com.emergencyalerts.exception.InvalidStateTransitionException;
import com.emergencyalerts.exception.ValidationException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * The alert aggregate: content, target areas and lifecycle status.
 *
 * <p>Instances are immutable. Every lifecycle operation is a total function of the current
 * state and its inputs: it returns the next state or throws a typed exception, and never
 * mutates anything on failure. Persisting the result (and detecting lost races) is the
 * caller's job, see {@code ApprovalCoordinator}.
 *
 * <p>Every successful transition increments {@code version} by one and moves
 * {@code updatedAt} strictly forward, even when the clock has not advanced since the
 * previous write. The version is the optimistic-concurrency token.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    private static final int LANGUAGE_CODE_MIN_LENGTH = 2;
    private static final int LANGUAGE_CODE_MAX_LENGTH = 10;

    String id;
    String headline;
    String description;
    Severity severity;
    ChannelType channelType;
    String languageCode;
    List<Area> areas;
    Instant expiresAt;
    AlertStatus status;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    /** Who approved or rejected the alert. Null until decided. */
    String approverId;

    String rejectionReason;
    Instant decidedAt;
    String cancelledBy;
    Instant deliveredAt;
    long version;

    // ==================== Creation ====================

    /**
     * Validates a draft and mints a new alert in DRAFT, or PENDING_APPROVAL when the draft
     * asks to be submitted immediately.
     *
     * @throws ValidationException on any field violation
     * @throws com.emergencyalerts.exception.InvalidPolygonException when an area's geometry is invalid
     */
    public static Alert create(
            AlertDraft draft, String creatorId, AlertPolicy policy, Instant now, IdGenerator ids) {
        if (draft == null) {
            throw new ValidationException("Alert details are required");
        }
        requireActor(creatorId, "createdBy");
        String headline = requireText(draft.getHeadline(), "headline", policy.getHeadlineMaxLength());
        String description = requireText(draft.getDescription(), "description", policy.getDescriptionMaxLength());
        if (draft.getSeverity() == null) {
            throw new ValidationException("severity", "Severity is required");
        }
        if (draft.getChannelType() == null) {
            throw new ValidationException("channelType", "Channel type is required");
        }
        String languageCode = resolveLanguageCode(draft.getLanguageCode(), policy);
        if (draft.getExpiresAt() == null) {
            throw new ValidationException("expiresAt", "Expiry is required");
        }
        if (!draft.getExpiresAt().isAfter(now)) {
            throw new ValidationException("expiresAt", "Expiry must be in the future");
        }
        if (draft.getAreas() == null || draft.getAreas().isEmpty()) {
            throw new ValidationException("areas", "At least one area is required");
        }
        List<Area> areas = new ArrayList<>(draft.getAreas().size());
        for (int i = 0; i < draft.getAreas().size(); i++) {
            areas.add(Area.create(i, draft.getAreas().get(i), policy, ids));
        }

        Instant stamp = now.truncatedTo(ChronoUnit.MILLIS);
        return Alert.builder()
                .id(ids.newId())
                .headline(headline)
                .description(description)
                .severity(draft.getSeverity())
                .channelType(draft.getChannelType())
                .languageCode(languageCode)
                .areas(List.copyOf(areas))
                .expiresAt(draft.getExpiresAt())
                .status(draft.isSubmit() ? AlertStatus.PENDING_APPROVAL : AlertStatus.DRAFT)
                .createdBy(creatorId.trim())
                .createdAt(stamp)
                .updatedAt(stamp)
                .version(1L)
                .build();
    }

    // ==================== Transitions ====================

    /** DRAFT to PENDING_APPROVAL. */
    public Alert submit(String actorId, Instant now) {
        requireActor(actorId, "actorId");
        requireTransition(AlertStatus.PENDING_APPROVAL, now);
        return advance(AlertStatus.PENDING_APPROVAL, now).build();
    }

    /** PENDING_APPROVAL to APPROVED, refused once the alert has expired. */
    public Alert approve(String approverId, Instant now) {
        requireActor(approverId, "approverId");
        requireTransition(AlertStatus.APPROVED, now);
        Instant stamp = nextUpdatedAt(now);
        return advance(AlertStatus.APPROVED, now)
                .approverId(approverId.trim())
                .decidedAt(stamp)
                .build();
    }

    /** PENDING_APPROVAL to REJECTED. A non-blank reason is mandatory. */
    public Alert reject(String approverId, String reason, AlertPolicy policy, Instant now) {
        requireActor(approverId, "approverId");
        String trimmedReason = requireText(reason, "reason", policy.getRejectionReasonMaxLength());
        requireTransition(AlertStatus.REJECTED, now);
        Instant stamp = nextUpdatedAt(now);
        return advance(AlertStatus.REJECTED, now)
                .approverId(approverId.trim())
                .rejectionReason(trimmedReason)
                .decidedAt(stamp)
                .build();
    }

    /** PENDING_APPROVAL or APPROVED to CANCELLED. */
    public Alert cancel(String actorId, Instant now) {
        requireActor(actorId, "actorId");
        requireTransition(AlertStatus.CANCELLED, now);
        return advance(AlertStatus.CANCELLED, now).cancelledBy(actorId.trim()).build();
    }

    /** APPROVED to DELIVERED, driven by the first successful delivery attempt. */
    public Alert markDelivered(Instant now) {
        requireTransition(AlertStatus.DELIVERED, now);
        return advance(AlertStatus.DELIVERED, now).deliveredAt(nextUpdatedAt(now)).build();
    }

    /** Any non-terminal status to EXPIRED, only once {@code expiresAt} has passed. */
    public Alert expire(Instant now) {
        if (!status.canTransitionTo(AlertStatus.EXPIRED)) {
            throw new InvalidStateTransitionException(id, status, AlertStatus.EXPIRED);
        }
        if (!isExpiredAt(now)) {
            throw new InvalidStateTransitionException(
                    id, status, AlertStatus.EXPIRED, "expiry " + expiresAt + " has not passed");
        }
        return advance(AlertStatus.EXPIRED, now).build();
    }

    // ==================== Queries ====================

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** Status as a reader should see it: non-terminal alerts past expiry read as EXPIRED. */
    public AlertStatus effectiveStatus(Instant now) {
        return status.expiresWithTime() && isExpiredAt(now) ? AlertStatus.EXPIRED : status;
    }

    public VersionToken versionToken() {
        return VersionToken.of(version);
    }

    // ==================== Internals ====================

    private void requireTransition(AlertStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, status, target);
        }
        if (isExpiredAt(now)) {
            throw new InvalidStateTransitionException(
                    id, AlertStatus.EXPIRED, target, "alert expired at " + expiresAt);
        }
    }

    private AlertBuilder advance(AlertStatus target, Instant now) {
        return toBuilder().status(target).updatedAt(nextUpdatedAt(now)).version(version + 1);
    }

    private Instant nextUpdatedAt(Instant now) {
        Instant candidate = now.truncatedTo(ChronoUnit.MILLIS);
        return candidate.isAfter(updatedAt) ? candidate : updatedAt.plusMillis(1);
    }

    private static void requireActor(String actorId, String field) {
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
    }

    private static String requireText(String value, String field, int maxLength) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(field, field + " must not be empty");
        }
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field, field + " must be at most " + maxLength + " characters");
        }
        return trimmed;
    }

    private static String resolveLanguageCode(String languageCode, AlertPolicy policy) {
        if (languageCode == null || languageCode.isBlank()) {
            return policy.getDefaultLanguageCode();
        }
        String trimmed = languageCode.trim();
        if (trimmed.length() < LANGUAGE_CODE_MIN_LENGTH || trimmed.length() > LANGUAGE_CODE_MAX_LENGTH) {
            throw new ValidationException(
                    "languageCode",
                    "Language code must be between " + LANGUAGE_CODE_MIN_LENGTH + " and "
                            + LANGUAGE_CODE_MAX_LENGTH + " characters");
        }
        return trimmed;
    }
}
