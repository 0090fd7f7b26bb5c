package com.emergencyalerts.approval;

import com.emergencyalerts.delivery.DeliveryGateway;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertDecision;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.domain.vo.VersionToken;
import com.emergencyalerts.event.AlertEventType;
import com.emergencyalerts.event.EventPublisherHelper;
import com.emergencyalerts.exception.ConcurrentAlertModificationException;
import com.emergencyalerts.exception.InvalidStateTransitionException;
import com.emergencyalerts.exception.OperationCancelledException;
import com.emergencyalerts.exception.ResourceNotFoundException;
import com.emergencyalerts.exception.UpstreamUnavailableException;
import com.emergencyalerts.observability.AlertMetricsService;
import com.emergencyalerts.repository.AlertStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes alert state changes under optimistic concurrency.
 *
 * <p>Every write follows the same path:
 * <ol>
 *   <li>read the alert and its version</li>
 *   <li>if the caller supplied a version token that no longer matches, fail with
 *       {@link ConcurrentAlertModificationException} without writing</li>
 *   <li>apply the pure transition on {@link Alert}</li>
 *   <li>honour the caller's {@link CancellationSignal}</li>
 *   <li>compare-and-swap on the version read in step 1</li>
 * </ol>
 *
 * <p>Of several concurrent writers that read the same version, exactly one wins the swap. The
 * others get {@link ConcurrentAlertModificationException}, or {@link InvalidStateTransitionException}
 * if they read the alert after the winner committed. Conflicts are reported, never retried: an
 * approval has to trace back to a single human decision. No locks are taken.
 *
 * <p>An approval then asks the delivery transport to start. If the transport is unreachable the
 * approval stays committed and the failure is reported in the returned {@link AlertDecision}.
 */
@Service
public class ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

    private final AlertStore alertStore;
    private final DeliveryGateway deliveryGateway;
    private final EventPublisherHelper eventPublisherHelper;
    private final AlertMetricsService alertMetricsService;
    private final AlertPolicy alertPolicy;
    private final Clock clock;

    public ApprovalCoordinator(
            AlertStore alertStore,
            DeliveryGateway deliveryGateway,
            EventPublisherHelper eventPublisherHelper,
            AlertMetricsService alertMetricsService,
            AlertPolicy alertPolicy,
            Clock clock) {
        this.alertStore = alertStore;
        this.deliveryGateway = deliveryGateway;
        this.eventPublisherHelper = eventPublisherHelper;
        this.alertMetricsService = alertMetricsService;
        this.alertPolicy = alertPolicy;
        this.clock = clock;
    }

    // ==================== Operator / approver actions ====================

    public AlertDecision approve(String alertId, String approverId, VersionToken expectedVersion) {
        return approve(alertId, approverId, expectedVersion, CancellationSignal.currentThread());
    }

    public AlertDecision approve(
            String alertId, String approverId, VersionToken expectedVersion, CancellationSignal cancellation) {
        Alert approved = applyTransition(
                alertId,
                expectedVersion,
                cancellation,
                AlertEventType.APPROVED,
                approverId,
                (alert, now) -> alert.approve(approverId, now));
        return requestDelivery(approved);
    }

    public Alert reject(String alertId, String approverId, String reason, VersionToken expectedVersion) {
        return reject(alertId, approverId, reason, expectedVersion, CancellationSignal.currentThread());
    }

    public Alert reject(
            String alertId,
            String approverId,
            String reason,
            VersionToken expectedVersion,
            CancellationSignal cancellation) {
        return applyTransition(
                alertId,
                expectedVersion,
                cancellation,
                AlertEventType.REJECTED,
                approverId,
                (alert, now) -> alert.reject(approverId, reason, alertPolicy, now));
    }

    public Alert cancel(String alertId, String actorId, VersionToken expectedVersion) {
        return applyTransition(
                alertId,
                expectedVersion,
                CancellationSignal.currentThread(),
                AlertEventType.CANCELLED,
                actorId,
                (alert, now) -> alert.cancel(actorId, now));
    }

    public Alert submit(String alertId, String actorId, VersionToken expectedVersion) {
        return applyTransition(
                alertId,
                expectedVersion,
                CancellationSignal.currentThread(),
                AlertEventType.SUBMITTED,
                actorId,
                (alert, now) -> alert.submit(actorId, now));
    }

    /**
     * Asks the transport to deliver an APPROVED alert again, e.g. after the request made at
     * approval time failed. Does not change the alert.
     */
    public AlertDecision retriggerDelivery(String alertId) {
        Alert alert = load(alertId);
        Instant now = clock.instant();
        AlertStatus effective = alert.effectiveStatus(now);
        if (effective != AlertStatus.APPROVED) {
            throw new InvalidStateTransitionException(
                    alertId, effective, AlertStatus.DELIVERED, "delivery can only be requested for approved alerts");
        }
        return requestDelivery(alert);
    }

    // ==================== System-driven transitions ====================

    /** APPROVED to DELIVERED once the transport reports a success. */
    public Alert markDelivered(String alertId) {
        return applyTransition(
                alertId, null, CancellationSignal.none(), AlertEventType.DELIVERED, null, (alert, now) ->
                        alert.markDelivered(now));
    }

    /** Persists EXPIRED for an alert whose expiry has passed. */
    public Alert expire(String alertId) {
        return applyTransition(
                alertId, null, CancellationSignal.none(), AlertEventType.EXPIRED, null, (alert, now) ->
                        alert.expire(now));
    }

    // ==================== Internals ====================

    private Alert applyTransition(
            String alertId,
            VersionToken expectedVersion,
            CancellationSignal cancellation,
            AlertEventType eventType,
            String actorId,
            BiFunction<Alert, Instant, Alert> transition) {
        Alert current = load(alertId);

        if (expectedVersion != null && !expectedVersion.matches(current.getVersion())) {
            alertMetricsService.recordApprovalConflict();
            log.warn(
                    "Stale version for alert {} on {}: expected {}, current {}",
                    alertId,
                    eventType,
                    expectedVersion,
                    current.getVersion());
            throw new ConcurrentAlertModificationException(
                    alertId, expectedVersion.value(), current.versionToken().value());
        }

        Alert next = transition.apply(current, clock.instant());

        if (cancellation.isCancelled()) {
            log.info("Alert {} {} cancelled by caller before commit", alertId, eventType);
            throw new OperationCancelledException(eventType.name().toLowerCase(Locale.ROOT));
        }

        if (!alertStore.compareAndSet(next, current.getVersion())) {
            alertMetricsService.recordApprovalConflict();
            log.warn("Lost compare-and-swap on alert {} for {} at version {}", alertId, eventType, current.getVersion());
            throw new ConcurrentAlertModificationException(alertId, current.versionToken().value(), null);
        }

        log.info(
                "Alert {} {}: {} -> {} by {} (version {})",
                alertId,
                eventType,
                current.getStatus(),
                next.getStatus(),
                actorId != null ? actorId : "system",
                next.getVersion());
        eventPublisherHelper.publishAlertTransition(this, next, eventType, current.getStatus(), actorId);
        return next;
    }

    private AlertDecision requestDelivery(Alert alert) {
        try {
            deliveryGateway.requestDelivery(alert);
            return AlertDecision.builder().alert(alert).deliveryRequested(true).build();
        } catch (UpstreamUnavailableException e) {
            log.warn("Alert {} approved but delivery could not be requested: {}", alert.getId(), e.getMessage());
            return AlertDecision.builder()
                    .alert(alert)
                    .deliveryRequested(false)
                    .deliveryFailureReason(e.getMessage())
                    .build();
        }
    }

    private Alert load(String alertId) {
        return alertStore.findById(alertId).orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
    }
}
